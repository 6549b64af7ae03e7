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
import com.dedicatedcode.crimecity.model.IncidentRecord;
import com.dedicatedcode.crimecity.service.aggregation.AggregationResult;
import com.dedicatedcode.crimecity.service.aggregation.Aggregator;
import com.dedicatedcode.crimecity.service.aggregation.CellKeyResolver;
import com.dedicatedcode.crimecity.service.aggregation.IncidentFilter;
import com.dedicatedcode.crimecity.service.classification.CategoryClassifier;
import com.dedicatedcode.crimecity.service.io.AggregatedTableIO;
import com.dedicatedcode.crimecity.service.io.IncidentReader;
import com.dedicatedcode.crimecity.service.io.PopulationTableIO;
import com.dedicatedcode.crimecity.service.population.PopulationJoiner;
import com.dedicatedcode.crimecity.service.spatial.SpatialIndexer;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Incidents counted per grid cell, joined with the population table of the same resolution.
 */
class CellEventsStage extends AbstractEventsStage {

    private final Path incidents;
    private final Path populationTable;
    private final SpatialIndexer indexer;
    private final int resolution;
    private final CategoryClassifier classifier;
    private final IncidentFilter filter;
    private final Aggregator aggregator;
    private final long minPopulation;
    private final IncidentReader incidentReader;
    private final PopulationTableIO populationTableIO;
    private final PopulationJoiner joiner = new PopulationJoiner();

    CellEventsStage(String name, Path output, Path incidents, Path populationTable, SpatialIndexer indexer, int resolution,
                    CategoryClassifier classifier, IncidentFilter filter, Aggregator aggregator, long minPopulation,
                    IncidentReader incidentReader, PopulationTableIO populationTableIO, AggregatedTableIO tableIO,
                    ObjectMapper objectMapper, BuildStatistics stats) {
        super(name, output, tableIO, objectMapper, stats);
        this.incidents = incidents;
        this.populationTable = populationTable;
        this.indexer = indexer;
        this.resolution = resolution;
        this.classifier = classifier;
        this.filter = filter;
        this.aggregator = aggregator;
        this.minPopulation = minPopulation;
        this.incidentReader = incidentReader;
        this.populationTableIO = populationTableIO;
    }

    @Override
    public List<Path> inputs() {
        return List.of(incidents, populationTable);
    }

    @Override
    public Map<String, String> parameters() {
        Map<String, String> parameters = new HashMap<>(classifier.fingerprintParameters());
        parameters.put("grid.system", indexer.name());
        parameters.put("grid.resolution", Integer.toString(resolution));
        parameters.put("aggregation.exclusions", filter.describe());
        parameters.put("reliability.min-population", Long.toString(minPopulation));
        return parameters;
    }

    @Override
    protected AggregationResult aggregate() throws IOException {
        CellKeyResolver resolver = new CellKeyResolver(indexer, resolution);
        try (Stream<IncidentRecord> records = incidentReader.stream(incidents)) {
            return aggregator.aggregate(records, filter, resolver);
        }
    }

    @Override
    protected List<AggregatedUnit> join(AggregationResult result) throws IOException {
        return joiner.joinByCell(result.units(), populationTableIO.read(populationTable), minPopulation);
    }
}
