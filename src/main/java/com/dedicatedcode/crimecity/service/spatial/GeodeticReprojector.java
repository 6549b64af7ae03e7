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
 * Identity conversion for sources already in EPSG:4326, axis order x = longitude, y = latitude.
 */
public class GeodeticReprojector implements CoordinateReprojector {

    @Override
    public String sourceCrs() {
        return ReferenceSystems.WGS84;
    }

    @Override
    public LatLon toGeodetic(double x, double y) {
        return new LatLon(y, x);
    }
}
