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

import com.dedicatedcode.crimecity.dto.GeoJsonGeometry;
import com.dedicatedcode.crimecity.model.LatLon;
import com.dedicatedcode.crimecity.model.SpatialCell;
import com.dedicatedcode.crimecity.service.spatial.SpatialIndexer;

import java.util.List;
import java.util.Optional;

/**
 * Cell polygons computed from the grid itself.
 */
public class CellBoundaryProvider implements BoundaryProvider {

    private final SpatialIndexer indexer;
    private final int resolution;

    public CellBoundaryProvider(SpatialIndexer indexer, int resolution) {
        indexer.checkResolution(resolution);
        this.indexer = indexer;
        this.resolution = resolution;
    }

    @Override
    public Optional<GeoJsonGeometry> boundaryFor(String key) {
        try {
            List<LatLon> vertices = indexer.boundaryForCell(new SpatialCell(key, resolution));
            return vertices.size() < 3 ? Optional.empty() : Optional.of(GeoJsonGeometry.polygon(vertices));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
