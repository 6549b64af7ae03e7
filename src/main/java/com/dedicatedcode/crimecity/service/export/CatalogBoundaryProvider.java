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
import com.dedicatedcode.crimecity.exception.InputMissingException;
import com.dedicatedcode.crimecity.exception.SchemaMismatchException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Municipality boundaries from a GeoJSON FeatureCollection whose features carry the unit code in
 * {@code properties.id}.
 */
public class CatalogBoundaryProvider implements BoundaryProvider {

    private static final Logger logger = LoggerFactory.getLogger(CatalogBoundaryProvider.class);

    private final Map<String, GeoJsonGeometry> boundaries;

    private CatalogBoundaryProvider(Map<String, GeoJsonGeometry> boundaries) {
        this.boundaries = boundaries;
    }

    public static CatalogBoundaryProvider load(Path geoJsonFile, ObjectMapper objectMapper) throws IOException {
        if (!Files.isRegularFile(geoJsonFile)) {
            throw new InputMissingException(geoJsonFile);
        }
        JsonNode root = objectMapper.readTree(geoJsonFile.toFile());
        JsonNode features = root.path("features");
        if (!features.isArray()) {
            throw new SchemaMismatchException(geoJsonFile.toString(), "features");
        }
        Map<String, GeoJsonGeometry> boundaries = new HashMap<>();
        for (JsonNode feature : features) {
            JsonNode id = feature.path("properties").path("id");
            if (id.isMissingNode() || id.isNull()) {
                throw new SchemaMismatchException(geoJsonFile.toString(), "properties.id");
            }
            JsonNode geometry = feature.path("geometry");
            if (!geometry.isObject()) {
                logger.warn("Boundary {} in {} has no geometry", id.asText(), geoJsonFile);
                continue;
            }
            boundaries.put(id.asText(), objectMapper.treeToValue(geometry, GeoJsonGeometry.class));
        }
        logger.info("Loaded {} boundaries from {}", boundaries.size(), geoJsonFile);
        return new CatalogBoundaryProvider(boundaries);
    }

    @Override
    public Optional<GeoJsonGeometry> boundaryFor(String key) {
        return Optional.ofNullable(boundaries.get(key));
    }

    public int size() {
        return boundaries.size();
    }
}
