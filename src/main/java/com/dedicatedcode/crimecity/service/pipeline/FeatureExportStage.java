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
import com.dedicatedcode.crimecity.service.export.BoundaryProvider;
import com.dedicatedcode.crimecity.service.export.ExportResult;
import com.dedicatedcode.crimecity.service.export.GeoJsonLinesFeatureSink;
import com.dedicatedcode.crimecity.service.export.StreamingTileExporter;
import com.dedicatedcode.crimecity.service.io.AggregatedTableIO;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Aggregated table to GeoJSON lines, one feature per unit with a known boundary.
 */
class FeatureExportStage implements BuildStage {

    @FunctionalInterface
    interface BoundarySource {
        BoundaryProvider open() throws IOException;
    }

    private final String name;
    private final Path eventsTable;
    private final List<Path> boundaryInputs;
    private final BoundarySource boundaries;
    private final StreamingTileExporter exporter;
    private final boolean compress;
    private final Path output;
    private final AggregatedTableIO tableIO;
    private final ObjectMapper objectMapper;
    private final BuildStatistics stats;

    FeatureExportStage(String name, Path eventsTable, List<Path> boundaryInputs, BoundarySource boundaries,
                       StreamingTileExporter exporter, boolean compress, Path output, AggregatedTableIO tableIO,
                       ObjectMapper objectMapper, BuildStatistics stats) {
        this.name = name;
        this.eventsTable = eventsTable;
        this.boundaryInputs = List.copyOf(boundaryInputs);
        this.boundaries = boundaries;
        this.exporter = exporter;
        this.compress = compress;
        this.output = output;
        this.tableIO = tableIO;
        this.objectMapper = objectMapper;
        this.stats = stats;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<Path> inputs() {
        List<Path> inputs = new ArrayList<>();
        inputs.add(eventsTable);
        inputs.addAll(boundaryInputs);
        return inputs;
    }

    @Override
    public Map<String, String> parameters() {
        return Map.of("export.layer", exporter.schema().layer(),
                      "export.attributes", String.join(",", exporter.schema().attributeNames()),
                      "export.compress", Boolean.toString(compress));
    }

    @Override
    public Path output() {
        return output;
    }

    @Override
    public void build(Path target) throws IOException {
        BoundaryProvider provider = boundaries.open();
        ExportResult result;
        try (Stream<AggregatedUnit> units = tableIO.stream(eventsTable);
             GeoJsonLinesFeatureSink sink = new GeoJsonLinesFeatureSink(target, compress, objectMapper)) {
            result = exporter.export(units, provider, sink);
        }
        stats.recordExport(result);
    }
}
