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

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "crimecity")
public class CrimeCityConfiguration {

    private String dataDir = "./data";

    private GridConfiguration grid = new GridConfiguration();
    private SourcesConfiguration sources = new SourcesConfiguration();
    private ClassificationConfiguration classification = new ClassificationConfiguration();
    private AggregationConfiguration aggregation = new AggregationConfiguration();
    private ReliabilityConfiguration reliability = new ReliabilityConfiguration();
    private PipelineConfiguration pipeline = new PipelineConfiguration();
    private ExportConfiguration export = new ExportConfiguration();

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public GridConfiguration getGrid() {
        return grid;
    }

    public void setGrid(GridConfiguration grid) {
        this.grid = grid;
    }

    public SourcesConfiguration getSources() {
        return sources;
    }

    public void setSources(SourcesConfiguration sources) {
        this.sources = sources;
    }

    public ClassificationConfiguration getClassification() {
        return classification;
    }

    public void setClassification(ClassificationConfiguration classification) {
        this.classification = classification;
    }

    public AggregationConfiguration getAggregation() {
        return aggregation;
    }

    public void setAggregation(AggregationConfiguration aggregation) {
        this.aggregation = aggregation;
    }

    public ReliabilityConfiguration getReliability() {
        return reliability;
    }

    public void setReliability(ReliabilityConfiguration reliability) {
        this.reliability = reliability;
    }

    public PipelineConfiguration getPipeline() {
        return pipeline;
    }

    public void setPipeline(PipelineConfiguration pipeline) {
        this.pipeline = pipeline;
    }

    public ExportConfiguration getExport() {
        return export;
    }

    public void setExport(ExportConfiguration export) {
        this.export = export;
    }

    public static class GridConfiguration {

        /**
         * Spatial grid used for cell aggregation, either "h3" or "s2".
         */
        private String system = "h3";
        /**
         * Resolutions built by default. H3: 4 (~25km), 5 (~8km), 6 (~3km).
         */
        private List<Integer> resolutions = new ArrayList<>(List.of(4, 5, 6));

        public String getSystem() {
            return system;
        }

        public void setSystem(String system) {
            this.system = system;
        }

        public List<Integer> getResolutions() {
            return resolutions;
        }

        public void setResolutions(List<Integer> resolutions) {
            this.resolutions = resolutions;
        }
    }

    /**
     * Input file locations. Unset paths resolve against the data directory.
     */
    public static class SourcesConfiguration {

        private String incidents;
        private String populationGrid;
        private String populationCrs = "EPSG:3006";
        private String municipalityCatalog;
        private String municipalityBoundaries;

        public String getIncidents() {
            return incidents;
        }

        public void setIncidents(String incidents) {
            this.incidents = incidents;
        }

        public String getPopulationGrid() {
            return populationGrid;
        }

        public void setPopulationGrid(String populationGrid) {
            this.populationGrid = populationGrid;
        }

        public String getPopulationCrs() {
            return populationCrs;
        }

        public void setPopulationCrs(String populationCrs) {
            this.populationCrs = populationCrs;
        }

        public String getMunicipalityCatalog() {
            return municipalityCatalog;
        }

        public void setMunicipalityCatalog(String municipalityCatalog) {
            this.municipalityCatalog = municipalityCatalog;
        }

        public String getMunicipalityBoundaries() {
            return municipalityBoundaries;
        }

        public void setMunicipalityBoundaries(String municipalityBoundaries) {
            this.municipalityBoundaries = municipalityBoundaries;
        }
    }

    public static class ClassificationConfiguration {

        /**
         * Location of the event type table, a Spring resource location.
         */
        private String table = "classpath:event_types.json";

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }
    }

    public static class AggregationConfiguration {

        /**
         * Raw types that are editorial content rather than incidents, as regular expressions.
         */
        private List<String> excludedTypePatterns = new ArrayList<>(List.of("Sammanfattning.*"));
        /**
         * Location names that do not denote a catalog unit (county level reports).
         * Only applied on the municipality path.
         */
        private List<String> excludedLocationPatterns = new ArrayList<>(List.of(".* län"));
        private int threads = Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
        private int chunkSize = 50_000;

        public List<String> getExcludedTypePatterns() {
            return excludedTypePatterns;
        }

        public void setExcludedTypePatterns(List<String> excludedTypePatterns) {
            this.excludedTypePatterns = excludedTypePatterns;
        }

        public List<String> getExcludedLocationPatterns() {
            return excludedLocationPatterns;
        }

        public void setExcludedLocationPatterns(List<String> excludedLocationPatterns) {
            this.excludedLocationPatterns = excludedLocationPatterns;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = Math.max(1, threads);
        }

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = Math.max(1, chunkSize);
        }
    }

    /**
     * Minimum population below which a rate is flagged as low reliability.
     * The cell grid and the municipality catalog are separate consumers and keep separate values.
     */
    public static class ReliabilityConfiguration {

        private long cellMinPopulation = 100;
        private long catalogMinPopulation = 100;

        public long getCellMinPopulation() {
            return cellMinPopulation;
        }

        public void setCellMinPopulation(long cellMinPopulation) {
            this.cellMinPopulation = cellMinPopulation;
        }

        public long getCatalogMinPopulation() {
            return catalogMinPopulation;
        }

        public void setCatalogMinPopulation(long catalogMinPopulation) {
            this.catalogMinPopulation = catalogMinPopulation;
        }
    }

    public static class PipelineConfiguration {

        /**
         * Number of build targets (resolutions, municipalities) built concurrently.
         */
        private int threads = Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
        private boolean municipalitiesEnabled = true;

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = Math.max(1, threads);
        }

        public boolean isMunicipalitiesEnabled() {
            return municipalitiesEnabled;
        }

        public void setMunicipalitiesEnabled(boolean municipalitiesEnabled) {
            this.municipalitiesEnabled = municipalitiesEnabled;
        }
    }

    public static class ExportConfiguration {

        private boolean compress = true;
        private boolean tilePackagingEnabled = false;
        private String tippecanoeBinary = "tippecanoe";
        private int maxZoom = 10;

        public boolean isCompress() {
            return compress;
        }

        public void setCompress(boolean compress) {
            this.compress = compress;
        }

        public boolean isTilePackagingEnabled() {
            return tilePackagingEnabled;
        }

        public void setTilePackagingEnabled(boolean tilePackagingEnabled) {
            this.tilePackagingEnabled = tilePackagingEnabled;
        }

        public String getTippecanoeBinary() {
            return tippecanoeBinary;
        }

        public void setTippecanoeBinary(String tippecanoeBinary) {
            this.tippecanoeBinary = tippecanoeBinary;
        }

        public int getMaxZoom() {
            return maxZoom;
        }

        public void setMaxZoom(int maxZoom) {
            this.maxZoom = maxZoom;
        }
    }
}
