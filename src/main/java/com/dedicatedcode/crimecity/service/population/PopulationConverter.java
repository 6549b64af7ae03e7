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

package com.dedicatedcode.crimecity.service.population;

import com.dedicatedcode.crimecity.model.LatLon;
import com.dedicatedcode.crimecity.model.PopulationCount;
import com.dedicatedcode.crimecity.model.PopulationGridCell;
import com.dedicatedcode.crimecity.model.SpatialCell;
import com.dedicatedcode.crimecity.service.spatial.CoordinateReprojector;
import com.dedicatedcode.crimecity.service.spatial.SpatialIndexer;
import org.locationtech.jts.geom.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Re-indexes the population grid into the cells of one resolution.
 * <p>
 * Each grid square is assigned as a whole to the cell containing its centroid. Squares are much
 * smaller than the cells at the resolutions built, so the error stays at the cell edges.
 */
public class PopulationConverter {

    private static final Logger logger = LoggerFactory.getLogger(PopulationConverter.class);

    private final CoordinateReprojector reprojector;
    private final SpatialIndexer indexer;

    public PopulationConverter(CoordinateReprojector reprojector, SpatialIndexer indexer) {
        this.reprojector = reprojector;
        this.indexer = indexer;
    }

    public PopulationConversion convert(Stream<PopulationGridCell> grid, int resolution) {
        indexer.checkResolution(resolution);
        Map<String, PopulationCount> byCell = new TreeMap<>();
        long rows = 0;
        long unmappable = 0;
        long empty = 0;

        Iterator<PopulationGridCell> iterator = grid.iterator();
        while (iterator.hasNext()) {
            PopulationGridCell square = iterator.next();
            rows++;
            if (square.population() <= 0) {
                empty++;
                continue;
            }
            Optional<SpatialCell> cell = cellOf(square, resolution);
            if (cell.isEmpty()) {
                unmappable++;
                continue;
            }
            String id = cell.get().id();
            PopulationCount current = byCell.getOrDefault(id, new PopulationCount(id, 0, 0, 0));
            byCell.put(id, current.add(square.population(), square.female(), square.male()));
        }

        if (unmappable > 0) {
            logger.warn("{} of {} populated grid rows could not be mapped to a {} r{} cell",
                    unmappable, rows - empty, indexer.name(), resolution);
        }
        PopulationConversion conversion = new PopulationConversion(new ArrayList<>(byCell.values()), rows, unmappable, empty);
        logger.info("Converted {} grid rows into {} {} r{} cells, population {}",
                rows, byCell.size(), indexer.name(), resolution, conversion.totalPopulation());
        return conversion;
    }

    private Optional<SpatialCell> cellOf(PopulationGridCell square, int resolution) {
        if (square.geometry() == null || square.geometry().isEmpty()) {
            return Optional.empty();
        }
        Point centroid = square.geometry().getCentroid();
        LatLon position = reprojector.toGeodetic(centroid.getX(), centroid.getY());
        return indexer.cellForPoint(position.lat(), position.lon(), resolution);
    }
}
