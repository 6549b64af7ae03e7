/*
 *  This file is part of crimecity.
 *
 *  CrimeCity is free software: you can redistribute it and/or
 *  modify it under the terms of the GNU Affero General Public License
 *  as published by the Free Software Foundation, either version 3 or
 *  any later version.
 *
 *  CrimeCity is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 *  See the GNU Affero General Public License for more details.
 * You should have received a copy of the GNU Affero General Public License
 * along with CrimeCity. If not, see <https://www.gnu.org/licenses/>.
 */

package com.dedicatedcode.crimecity.service.classification;

import com.dedicatedcode.crimecity.model.Category;

import java.util.Map;
import java.util.Set;

/**
 * Versioned mapping of raw incident types to categories.
 *
 * @param version    version declared by the table file
 * @param sha256     digest of the table file content, part of stage fingerprints
 * @param categories raw type to category
 * @param unresolved raw types whose category is still pending review, carried as {@link Category#OTHER}
 */
public record ClassificationTable(String version,
                                  String sha256,
                                  Map<String, Category> categories,
                                  Set<String> unresolved) {

    public ClassificationTable {
        categories = Map.copyOf(categories);
        unresolved = Set.copyOf(unresolved);
    }
}
