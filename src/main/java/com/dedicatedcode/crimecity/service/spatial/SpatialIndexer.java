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
import com.dedicatedcode.crimecity.model.SpatialCell;

import java.util.List;
import java.util.Optional;

/**
 * Deterministic mapping between geodetic points and the cells of a hierarchical grid.
 * Implementations are stateless and safe to share between threads.
 */
public interface SpatialIndexer {

    /**
     * Short name of the grid system, used in output file names ("h3", "s2").
     */
    String name();

    int minResolution();

    int maxResolution();

    /**
     * Returns the cell containing the point at the given resolution.
     *
     * @return the cell, or empty if the coordinates are not finite or out of range
     * @throws IllegalArgumentException if the resolution is not supported
     */
    Optional<SpatialCell> cellForPoint(double lat, double lon, int resolution);

    /**
     * Returns the vertices of the cell polygon in order, without repeating the first vertex.
     */
    List<LatLon> boundaryForCell(SpatialCell cell);

    /**
     * Returns the ancestor of the cell at a coarser resolution.
     */
    SpatialCell parentOf(SpatialCell cell, int resolution);

    default boolean supportsResolution(int resolution) {
        return resolution >= minResolution() && resolution <= maxResolution();
    }

    default void checkResolution(int resolution) {
        if (!supportsResolution(resolution)) {
            throw new IllegalArgumentException(String.format("%s resolution must be %d-%d, got: %d",
                    name(), minResolution(), maxResolution(), resolution));
        }
    }

    static boolean isValidCoordinate(double lat, double lon) {
        return Double.isFinite(lat) && Double.isFinite(lon)
                && lat >= -90.0 && lat <= 90.0
                && lon >= -180.0 && lon <= 180.0;
    }
}
