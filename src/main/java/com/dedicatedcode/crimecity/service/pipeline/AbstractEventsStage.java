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

import com.dedicatedcode.crimecity.model.AggregatedUnit;
import com.dedicatedcode.crimecity.model.AggregationSummary;
import com.dedicatedcode.crimecity.service.aggregation.AggregationResult;
import com.dedicatedcode.crimecity.service.io.AggregatedTableIO;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Aggregates incidents into a table of units and publishes the run's conservation summary
 * next to the table.
 */
abstract class AbstractEventsStage implements BuildStage {

    private final String name;
    private final Path output;
    private final AggregatedTableIO tableIO;
    private final ObjectMapper objectMapper;
    private final BuildStatistics stats;
    private volatile AggregationSummary summary;

    AbstractEventsStage(String name, Path output, AggregatedTableIO tableIO, ObjectMapper objectMapper, BuildStatistics stats) {
        this.name = name;
        this.output = output;
        this.tableIO = tableIO;
        this.objectMapper = objectMapper;
        this.stats = stats;
    }

    public static Path summaryPathFor(Path output) {
        return output.resolveSibling(output.getFileName() + ".summary.json");
    }

    /**
     * Counts the incidents of the unit kind this stage builds.
     */
    protected abstract AggregationResult aggregate() throws IOException;

    /**
     * Attaches population to the counted units.
     */
    protected abstract List<AggregatedUnit> join(AggregationResult result) throws IOException;

    @Override
    public String name() {
        return name;
    }

    @Override
    public Path output() {
        return output;
    }

    @Override
    public void build(Path target) throws IOException {
        AggregationResult result = aggregate();
        List<AggregatedUnit> units = join(result);
        long withoutPopulation = units.stream().filter(unit -> unit.getPopulation() == 0).count();
        tableIO.write(units, target);
        summary = result.summary().withUnits(units.size(), withoutPopulation);
        stats.recordAggregation(summary);
    }

    @Override
    public void afterPublish(Path output) throws IOException {
        AggregationSummary built = summary;
        if (built != null) {
            AtomicFiles.write(summaryPathFor(output),
                    target -> objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), built));
        }
    }
}
