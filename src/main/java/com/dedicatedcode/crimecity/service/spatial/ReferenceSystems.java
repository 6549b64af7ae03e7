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

package com.dedicatedcode.crimecity.service.spatial;

import java.util.Locale;

/**
 * Lookup of the reference systems population sources can be delivered in.
 */
public final class ReferenceSystems {

    public static final String WGS84 = "EPSG:4326";
    public static final String SWEREF99_TM = "EPSG:3006";

    private ReferenceSystems() {
    }

    public static CoordinateReprojector forCode(String code) {
        String normalized = code == null ? "" : code.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case SWEREF99_TM -> TransverseMercatorReprojector.sweref99Tm();
            case WGS84 -> new GeodeticReprojector();
            default -> throw new IllegalArgumentException("Unsupported reference system: " + code);
        };
    }
}
