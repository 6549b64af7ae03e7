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

import com.dedicatedcode.crimecity.dto.GeoJsonFeature;
import com.dedicatedcode.crimecity.dto.GeoJsonGeometry;
import com.dedicatedcode.crimecity.model.AggregatedUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Iterator;
import java.util.Optional;
import java.util.stream.Stream;

public class StreamingTileExporter implements TileExporter {

    private static final Logger logger = LoggerFactory.getLogger(StreamingTileExporter.class);

    private final FeatureSchema schema;

    public StreamingTileExporter(FeatureSchema schema) {
        this.schema = schema;
    }

    @Override
    public ExportResult export(Stream<AggregatedUnit> units, BoundaryProvider boundaries, FeatureSink sink) throws IOException {
        long exported = 0;
        long skipped = 0;
        Iterator<AggregatedUnit> iterator = units.iterator();
        while (iterator.hasNext()) {
            AggregatedUnit unit = iterator.next();
            Optional<GeoJsonGeometry> boundary = boundaries.boundaryFor(unit.getKey());
            if (boundary.isEmpty()) {
                skipped++;
                continue;
            }
            sink.accept(GeoJsonFeature.of(boundary.get(), schema.properties(unit)));
            exported++;
        }
        if (skipped > 0) {
            logger.warn("Layer {}: {} units without boundary were not exported", schema.layer(), skipped);
        }
        logger.info("Layer {}: exported {} features", schema.layer(), exported);
        return new ExportResult(exported, skipped);
    }

    public FeatureSchema schema() {
        return schema;
    }
}
