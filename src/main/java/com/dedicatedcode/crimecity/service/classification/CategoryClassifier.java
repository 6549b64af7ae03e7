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

/**
 * The one lookup from raw incident type to category, shared by the cell and the municipality path.
 */
public class CategoryClassifier {

    private final ClassificationTable table;

    public CategoryClassifier(ClassificationTable table) {
        this.table = table;
    }

    /**
     * Returns the category of a raw type; types not in the table are {@link Category#OTHER}.
     */
    public Category classify(String rawType) {
        if (rawType == null) {
            return Category.OTHER;
        }
        return table.categories().getOrDefault(rawType, Category.OTHER);
    }

    /**
     * Whether the type is one of the classification decisions still awaiting review.
     */
    public boolean isUnresolved(String rawType) {
        return rawType != null && table.unresolved().contains(rawType);
    }

    public String version() {
        return table.version();
    }

    /**
     * Version and content digest, declared as parameters of every stage consuming the table.
     */
    public Map<String, String> fingerprintParameters() {
        return Map.of("classification.version", table.version(),
                      "classification.sha256", table.sha256());
    }

    public ClassificationTable table() {
        return table;
    }
}
