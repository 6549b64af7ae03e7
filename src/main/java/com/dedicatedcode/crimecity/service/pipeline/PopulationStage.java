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

package com.dedicatedcode.crimecity.service.pipeline;

import com.dedicatedcode.crimecity.model.PopulationGridCell;
import com.dedicatedcode.crimecity.service.io.PopulationGridReader;
import com.dedicatedcode.crimecity.service.io.PopulationTableIO;
import com.dedicatedcode.crimecity.service.population.PopulationConversion;
import com.dedicatedcode.crimecity.service.population.PopulationConverter;
import com.dedicatedcode.crimecity.service.spatial.ReferenceSystems;
import com.dedicatedcode.crimecity.service.spatial.SpatialIndexer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Population grid to population per cell of one resolution.
 */
class PopulationStage implements BuildStage {

    private final String name;
    private final Path populationGrid;
    private final String crs;
    private final SpatialIndexer indexer;
    private final int resolution;
    private final Path output;
    private final PopulationGridReader gridReader;
    private final PopulationTableIO tableIO;
    private final BuildStatistics stats;

    PopulationStage(String name, Path populationGrid, String crs, SpatialIndexer indexer, int resolution, Path output,
                    PopulationGridReader gridReader, PopulationTableIO tableIO, BuildStatistics stats) {
        this.name = name;
        this.populationGrid = populationGrid;
        this.crs = crs;
        this.indexer = indexer;
        this.resolution = resolution;
        this.output = output;
        this.gridReader = gridReader;
        this.tableIO = tableIO;
        this.stats = stats;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<Path> inputs() {
        return List.of(populationGrid);
    }

    @Override
    public Map<String, String> parameters() {
        return Map.of("grid.system", indexer.name(),
                      "grid.resolution", Integer.toString(resolution),
                      "population.crs", crs);
    }

    @Override
    public Path output() {
        return output;
    }

    @Override
    public void build(Path target) throws IOException {
        PopulationConverter converter = new PopulationConverter(ReferenceSystems.forCode(crs), indexer);
        PopulationConversion conversion;
        try (Stream<PopulationGridCell> grid = gridReader.stream(populationGrid)) {
            conversion = converter.convert(grid, resolution);
        }
        tableIO.write(conversion.cells(), target);
        stats.recordPopulation(conversion);
    }
}
