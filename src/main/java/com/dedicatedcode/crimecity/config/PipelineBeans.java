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

package com.dedicatedcode.crimecity.config;

import com.dedicatedcode.crimecity.service.classification.CategoryClassifier;
import com.dedicatedcode.crimecity.service.classification.ClassificationTableLoader;
import com.dedicatedcode.crimecity.service.export.TilePackager;
import com.dedicatedcode.crimecity.service.export.TippecanoeTilePackager;
import com.dedicatedcode.crimecity.service.spatial.H3SpatialIndexer;
import com.dedicatedcode.crimecity.service.spatial.S2SpatialIndexer;
import com.dedicatedcode.crimecity.service.spatial.SpatialIndexer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

@Configuration
public class PipelineBeans {

    @Bean
    public SpatialIndexer spatialIndexer(CrimeCityConfiguration config) {
        String system = config.getGrid().getSystem() == null ? "h3" : config.getGrid().getSystem().toLowerCase(Locale.ROOT);
        return switch (system) {
            case "h3" -> new H3SpatialIndexer();
            case "s2" -> new S2SpatialIndexer();
            default -> throw new IllegalArgumentException("Unsupported grid system: " + config.getGrid().getSystem());
        };
    }

    /**
     * The one classifier shared by every aggregation path.
     */
    @Bean
    public CategoryClassifier categoryClassifier(ClassificationTableLoader loader, CrimeCityConfiguration config) {
        return new CategoryClassifier(loader.load(config.getClassification().getTable()));
    }

    @Bean
    public TilePackager tilePackager(CrimeCityConfiguration config) {
        return new TippecanoeTilePackager(config.getExport().getTippecanoeBinary());
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }
}
