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

import com.dedicatedcode.crimecity.config.CrimeCityConfiguration;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Where inputs are read from and outputs are published to, relative to the data directory.
 */
public class DataLayout {

    private final Path dataDir;
    private final CrimeCityConfiguration.SourcesConfiguration sources;
    private final boolean compress;

    public DataLayout(Path dataDir, CrimeCityConfiguration.SourcesConfiguration sources, boolean compress) {
        this.dataDir = dataDir;
        this.sources = sources;
        this.compress = compress;
    }

    public static DataLayout of(CrimeCityConfiguration config) {
        return new DataLayout(Paths.get(config.getDataDir()), config.getSources(), config.getExport().isCompress());
    }

    public Path dataDir() {
        return dataDir;
    }

    public Path incidents() {
        return source(sources.getIncidents(), dataDir.resolve("events.csv"));
    }

    public Path populationGrid() {
        return source(sources.getPopulationGrid(), dataDir.resolve("population").resolve("population_1km.csv"));
    }

    public Path municipalityCatalog() {
        return source(sources.getMunicipalityCatalog(), dataDir.resolve("municipalities").resolve("municipality_population.csv"));
    }

    public Path municipalityBoundaries() {
        return source(sources.getMunicipalityBoundaries(), dataDir.resolve("municipalities").resolve("boundaries.geojson"));
    }

    public Path populationTable(String grid, int resolution) {
        return dataDir.resolve(grid).resolve("population_r" + resolution + ".csv");
    }

    public Path cellEvents(String grid, int resolution) {
        return dataDir.resolve(grid).resolve("events_r" + resolution + ".csv");
    }

    public Path municipalityEvents() {
        return dataDir.resolve("municipalities").resolve("events.csv");
    }

    public Path cellFeatures(String grid, int resolution) {
        return dataDir.resolve("tiles").resolve("geojsonl").resolve(grid + "_r" + resolution + featureSuffix());
    }

    public Path municipalityFeatures() {
        return dataDir.resolve("tiles").resolve("geojsonl").resolve("municipalities" + featureSuffix());
    }

    public Path cellTiles(String grid, int resolution) {
        return dataDir.resolve("tiles").resolve("pmtiles").resolve(grid + "_r" + resolution + ".pmtiles");
    }

    public Path municipalityTiles() {
        return dataDir.resolve("tiles").resolve("pmtiles").resolve("municipalities.pmtiles");
    }

    public Path metadata() {
        return dataDir.resolve("crimecity_metadata.json");
    }

    private String featureSuffix() {
        return compress ? ".geojsonl.gz" : ".geojsonl";
    }

    private static Path source(String configured, Path fallback) {
        return configured == null || configured.isBlank() ? fallback : Paths.get(configured);
    }
}
