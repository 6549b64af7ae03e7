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

import com.dedicatedcode.crimecity.model.AdministrativeUnit;
import com.dedicatedcode.crimecity.model.AggregatedUnit;
import com.dedicatedcode.crimecity.model.IncidentRecord;
import com.dedicatedcode.crimecity.service.aggregation.AggregationResult;
import com.dedicatedcode.crimecity.service.aggregation.Aggregator;
import com.dedicatedcode.crimecity.service.aggregation.CatalogKeyResolver;
import com.dedicatedcode.crimecity.service.aggregation.IncidentFilter;
import com.dedicatedcode.crimecity.service.classification.CategoryClassifier;
import com.dedicatedcode.crimecity.service.io.AggregatedTableIO;
import com.dedicatedcode.crimecity.service.io.IncidentReader;
import com.dedicatedcode.crimecity.service.io.MunicipalityCatalogReader;
import com.dedicatedcode.crimecity.service.population.PopulationJoiner;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Incidents counted per municipality by location name. Every catalog unit gets a row.
 */
class MunicipalityEventsStage extends AbstractEventsStage {

    private final Path incidents;
    private final Path catalogFile;
    private final CategoryClassifier classifier;
    private final IncidentFilter filter;
    private final Aggregator aggregator;
    private final long minPopulation;
    private final IncidentReader incidentReader;
    private final MunicipalityCatalogReader catalogReader;
    private final PopulationJoiner joiner = new PopulationJoiner();
    private List<AdministrativeUnit> catalog;

    MunicipalityEventsStage(String name, Path output, Path incidents, Path catalogFile, CategoryClassifier classifier,
                            IncidentFilter filter, Aggregator aggregator, long minPopulation, IncidentReader incidentReader,
                            MunicipalityCatalogReader catalogReader, AggregatedTableIO tableIO, ObjectMapper objectMapper,
                            BuildStatistics stats) {
        super(name, output, tableIO, objectMapper, stats);
        this.incidents = incidents;
        this.catalogFile = catalogFile;
        this.classifier = classifier;
        this.filter = filter;
        this.aggregator = aggregator;
        this.minPopulation = minPopulation;
        this.incidentReader = incidentReader;
        this.catalogReader = catalogReader;
    }

    @Override
    public List<Path> inputs() {
        return List.of(incidents, catalogFile);
    }

    @Override
    public Map<String, String> parameters() {
        Map<String, String> parameters = new HashMap<>(classifier.fingerprintParameters());
        parameters.put("aggregation.exclusions", filter.describe());
        parameters.put("reliability.min-population", Long.toString(minPopulation));
        return parameters;
    }

    @Override
    protected AggregationResult aggregate() throws IOException {
        catalog = catalogReader.read(catalogFile);
        try (Stream<IncidentRecord> records = incidentReader.stream(incidents)) {
            return aggregator.aggregate(records, filter, new CatalogKeyResolver(catalog));
        }
    }

    @Override
    protected List<AggregatedUnit> join(AggregationResult result) {
        return joiner.joinByCatalog(catalog, result.units(), minPopulation);
    }
}
