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

import com.dedicatedcode.crimecity.model.LatLon;

/**
 * Converts coordinates of a source reference system into geodetic WGS84 latitude/longitude.
 */
public interface CoordinateReprojector {

    /**
     * EPSG code of the source reference system, e.g. "EPSG:3006".
     */
    String sourceCrs();

    /**
     * @param x easting (or longitude for geodetic sources)
     * @param y northing (or latitude for geodetic sources)
     */
    LatLon toGeodetic(double x, double y);
}
