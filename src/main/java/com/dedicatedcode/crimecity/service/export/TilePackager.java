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

package com.dedicatedcode.crimecity.service.export;

import java.nio.file.Path;

/**
 * Packs a feature file into a vector tile archive. The tiling itself is done by an external tool.
 */
public interface TilePackager {

    /**
     * @throws com.dedicatedcode.crimecity.exception.TilePackagingException if the tool is missing or fails
     */
    void pack(Path features, Path output, TilingOptions options);
}
