package com.dedicatedcode.crimecity.service.pipeline;

import com.dedicatedcode.crimecity.config.CrimeCityConfiguration;
import com.dedicatedcode.crimecity.service.aggregation.Aggregator;
import com.dedicatedcode.crimecity.service.aggregation.IncidentFilter;
import com.dedicatedcode.crimecity.service.classification.CategoryClassifier;
import com.dedicatedcode.crimecity.service.export.CatalogBoundaryProvider;
import com.dedicatedcode.crimecity.service.export.CellBoundaryProvider;
import com.dedicatedcode.crimecity.service.export.FeatureSchema;
import com.dedicatedcode.crimecity.service.export.StreamingTileExporter;
import com.dedicatedcode.crimecity.service.export.TilePackager;
import com.dedicatedcode.crimecity.service.export.TilingOptions;
import com.dedicatedcode.crimecity.service.io.AggregatedTableIO;
import com.dedicatedcode.crimecity.service.io.IncidentReader;
import com.dedicatedcode.crimecity.service.io.MunicipalityCatalogReader;
import com.dedicatedcode.crimecity.service.io.PopulationGridReader;
import com.dedicatedcode.crimecity.service.io.PopulationTableIO;
import com.dedicatedcode.crimecity.service.spatial.SpatialIndexer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Assembles the build graph: one target per grid resolution and one for the municipality catalog.
 * <p>
 * Resolution targets: {@code population-r -> events-r -> features-r [-> tiles-r]}.
 * Municipality target: {@code municipality-events -> municipality-features [-> municipality-tiles]}.
 */
@Service
public class BuildTargetFactory {

    public static final String MUNICIPALITIES = "municipalities";

    private final CrimeCityConfiguration config;
    private final SpatialIndexer indexer;
    private final CategoryClassifier classifier;
    private final TilePackager packager;
    private final ObjectMapper objectMapper;
    private final IncidentReader incidentReader;
    private final PopulationGridReader gridReader;
    private final MunicipalityCatalogReader catalogReader;
    private final PopulationTableIO populationTableIO;
    private final AggregatedTableIO aggregatedTableIO;

    public BuildTargetFactory(CrimeCityConfiguration config,
                              SpatialIndexer indexer,
                              CategoryClassifier classifier,
                              TilePackager packager,
                              ObjectMapper objectMapper,
                              IncidentReader incidentReader,
                              PopulationGridReader gridReader,
                              MunicipalityCatalogReader catalogReader,
                              PopulationTableIO populationTableIO,
                              AggregatedTableIO aggregatedTableIO) {
        this.config = config;
        this.indexer = indexer;
        this.classifier = classifier;
        this.packager = packager;
        this.objectMapper = objectMapper;
        this.incidentReader = incidentReader;
        this.gridReader = gridReader;
        this.catalogReader = catalogReader;
        this.populationTableIO = populationTableIO;
        this.aggregatedTableIO = aggregatedTableIO;
    }

    public List<BuildTarget> targets(BuildRequest request, BuildStatistics stats) {
        DataLayout layout = DataLayout.of(config);
        Aggregator aggregator = new Aggregator(classifier, config.getAggregation());
        List<BuildTarget> targets = new ArrayList<>();
        for (int resolution : request.resolutions()) {
            targets.add(cellTarget(layout, resolution, aggregator, stats));
        }
        if (request.municipalities()) {
            targets.add(municipalityTarget(layout, aggregator, stats));
        }
        return targets;
    }

    public static String cellTargetName(String grid, int resolution) {
        return grid + "_r" + resolution;
    }

    BuildTarget cellTarget(DataLayout layout, int resolution, Aggregator aggregator, BuildStatistics stats) {
        String grid = indexer.name();
        String suffix = "-r" + resolution;
        Path populationTable = layout.populationTable(grid, resolution);
        Path events = layout.cellEvents(grid, resolution);
        Path features = layout.cellFeatures(grid, resolution);
        FeatureSchema schema = FeatureSchema.cells(grid);
        boolean compress = config.getExport().isCompress();

        List<BuildStage> stages = new ArrayList<>();
        stages.add(new PopulationStage("population" + suffix, layout.populationGrid(), config.getSources().getPopulationCrs(),
                indexer, resolution, populationTable, gridReader, populationTableIO, stats));
        stages.add(new CellEventsStage("events" + suffix, events, layout.incidents(), populationTable, indexer, resolution,
                classifier, IncidentFilter.forCells(config.getAggregation()), aggregator,
                config.getReliability().getCellMinPopulation(), incidentReader, populationTableIO, aggregatedTableIO,
                objectMapper, stats));
        stages.add(new FeatureExportStage("features" + suffix, events, List.of(),
                () -> new CellBoundaryProvider(indexer, resolution), new StreamingTileExporter(schema), compress,
                features, aggregatedTableIO, objectMapper, stats));
        if (config.getExport().isTilePackagingEnabled()) {
            stages.add(new TilePackagingStage("tiles" + suffix, features, layout.cellTiles(grid, resolution),
                    TilingOptions.forResolution(schema, resolution, config.getExport().getMaxZoom()), packager));
        }
        return new BuildTarget(cellTargetName(grid, resolution), stages);
    }

    BuildTarget municipalityTarget(DataLayout layout, Aggregator aggregator, BuildStatistics stats) {
        Path events = layout.municipalityEvents();
        Path features = layout.municipalityFeatures();
        Path boundaries = layout.municipalityBoundaries();
        FeatureSchema schema = FeatureSchema.municipalities();

        List<BuildStage> stages = new ArrayList<>();
        stages.add(new MunicipalityEventsStage("municipality-events", events, layout.incidents(), layout.municipalityCatalog(),
                classifier, IncidentFilter.forCatalog(config.getAggregation()), aggregator,
                config.getReliability().getCatalogMinPopulation(), incidentReader, catalogReader, aggregatedTableIO,
                objectMapper, stats));
        stages.add(new FeatureExportStage("municipality-features", events, List.of(boundaries),
                () -> CatalogBoundaryProvider.load(boundaries, objectMapper), new StreamingTileExporter(schema),
                config.getExport().isCompress(), features, aggregatedTableIO, objectMapper, stats));
        if (config.getExport().isTilePackagingEnabled()) {
            stages.add(new TilePackagingStage("municipality-tiles", features, layout.municipalityTiles(),
                    TilingOptions.forMunicipalities(schema, config.getExport().getMaxZoom()), packager));
        }
        return new BuildTarget(MUNICIPALITIES, stages);
    }
}
