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

package com.dedicatedcode.crimecity.service.aggregation;

import com.dedicatedcode.crimecity.model.IncidentRecord;
import com.dedicatedcode.crimecity.model.SpatialCell;
import com.dedicatedcode.crimecity.service.spatial.SpatialIndexer;

import java.util.Optional;

/**
 * Keys incidents by the grid cell containing their coordinates.
 */
public class CellKeyResolver implements SpatialKeyResolver {

    private final SpatialIndexer indexer;
    private final int resolution;

    public CellKeyResolver(SpatialIndexer indexer, int resolution) {
        indexer.checkResolution(resolution);
        this.indexer = indexer;
        this.resolution = resolution;
    }

    @Override
    public Optional<String> keyFor(IncidentRecord record) {
        return indexer.cellForPoint(record.latitude(), record.longitude(), resolution).map(SpatialCell::id);
    }
}
