package com.dedicatedcode.crimecity.service.pipeline;

import com.dedicatedcode.crimecity.config.CrimeCityConfiguration;
import com.dedicatedcode.crimecity.model.AggregatedUnit;
import com.dedicatedcode.crimecity.model.AggregationSummary;
import com.dedicatedcode.crimecity.model.SpatialCell;
import com.dedicatedcode.crimecity.service.classification.CategoryClassifier;
import com.dedicatedcode.crimecity.service.classification.ClassificationTableLoader;
import com.dedicatedcode.crimecity.service.export.TippecanoeTilePackager;
import com.dedicatedcode.crimecity.service.io.AggregatedTableIO;
import com.dedicatedcode.crimecity.service.io.IncidentReader;
import com.dedicatedcode.crimecity.service.io.MunicipalityCatalogReader;
import com.dedicatedcode.crimecity.service.io.PopulationGridReader;
import com.dedicatedcode.crimecity.service.io.PopulationTableIO;
import com.dedicatedcode.crimecity.service.spatial.H3SpatialIndexer;
import com.dedicatedcode.crimecity.service.spatial.TransverseMercatorReprojector;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Builds a small data directory end to end: population, cell and municipality targets, without tile packaging.
 */
class PipelineOrchestratorTest {

    private static final double STOCKHOLM_LAT = 59.3293;
    private static final double STOCKHOLM_LON = 18.0686;
    private static final double UPPSALA_LAT = 59.8586;
    private static final double UPPSALA_LON = 17.6389;

    @TempDir
    Path dataDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final H3SpatialIndexer indexer = new H3SpatialIndexer();
    private final AggregatedTableIO tableIO = new AggregatedTableIO(objectMapper);
    private PipelineOrchestrator orchestrator;
    private BuildTargetFactory factory;
    private DataLayout layout;

    @BeforeEach
    void setUp() throws IOException {
        CrimeCityConfiguration config = new CrimeCityConfiguration();
        config.setDataDir(dataDir.toString());
        config.getExport().setCompress(false);
        config.getAggregation().setThreads(2);
        config.getAggregation().setChunkSize(2);
        config.getPipeline().setThreads(2);

        CategoryClassifier classifier = new CategoryClassifier(new ClassificationTableLoader().load("classpath:event_types.json"));
        factory = new BuildTargetFactory(config, indexer, classifier,
                new TippecanoeTilePackager("tippecanoe"), objectMapper, new IncidentReader(), new PopulationGridReader(),
                new MunicipalityCatalogReader(), new PopulationTableIO(), tableIO);
        orchestrator = new PipelineOrchestrator(config, factory, new StageRunner(new FingerprintService(), objectMapper),
                indexer, classifier, objectMapper);
        layout = DataLayout.of(config);

        writeInputs();
    }

    @Test
    void testBuildAllTargets() throws IOException {
        BuildReport report = orchestrator.build(new BuildRequest(List.of(5), true, false));

        assertThat(report.isSuccessful()).isTrue();
        assertThat(report.targets()).extracting(TargetReport::target).containsExactly("h3_r5", "municipalities");
        assertThat(report.target("h3_r5").stages()).extracting(StageOutcome::status)
                .containsOnly(StageStatus.BUILT);

        List<AggregatedUnit> cells = tableIO.read(layout.cellEvents("h3", 5));
        assertThat(cells).hasSize(2);
        AggregatedUnit stockholm = cells.get(0);
        assertThat(stockholm.getKey()).isEqualTo(cellOf(STOCKHOLM_LAT, STOCKHOLM_LON));
        assertThat(stockholm.getTotalCount()).isEqualTo(4);
        assertThat(stockholm.getDominantLocation()).isEqualTo("Stockholm");
        assertThat(stockholm.getPopulation()).isEqualTo(2000);
        assertThat(stockholm.getRatePer10000()).isCloseTo(20.0, within(1e-9));
        assertThat(stockholm.isLowReliability()).isFalse();
        AggregatedUnit uppsala = cells.get(1);
        assertThat(uppsala.getPopulation()).isEqualTo(50);
        assertThat(uppsala.isLowReliability()).isTrue();

        AggregationSummary cellSummary = objectMapper.readValue(
                AbstractEventsStage.summaryPathFor(layout.cellEvents("h3", 5)).toFile(), AggregationSummary.class);
        assertThat(cellSummary).isEqualTo(new AggregationSummary(7, 1, 1, 5, 2, 0));
        assertThat(cells.stream().mapToLong(AggregatedUnit::getTotalCount).sum())
                .isEqualTo(cellSummary.qualifyingRecords() - cellSummary.unmappedRecords());

        List<AggregatedUnit> municipalities = tableIO.read(layout.municipalityEvents());
        assertThat(municipalities).extracting(AggregatedUnit::getKey).containsExactly("0180", "0380", "2418");
        assertThat(municipalities.get(0).getTotalCount()).isEqualTo(3);
        assertThat(municipalities.get(0).getName()).isEqualTo("Stockholm");
        assertThat(municipalities.get(2).getTotalCount()).isZero();
        AggregationSummary municipalitySummary = objectMapper.readValue(
                AbstractEventsStage.summaryPathFor(layout.municipalityEvents()).toFile(), AggregationSummary.class);
        assertThat(municipalitySummary).isEqualTo(new AggregationSummary(7, 2, 1, 4, 3, 0));

        assertThat(Files.readAllLines(layout.cellFeatures("h3", 5))).hasSize(2);
        assertThat(Files.readAllLines(layout.municipalityFeatures())).hasSize(2);
        assertThat(Files.exists(StageManifest.pathFor(layout.municipalityFeatures()))).isTrue();

        JsonNode metadata = objectMapper.readTree(layout.metadata().toFile());
        assertThat(metadata.get("classificationVersion").asText()).isEqualTo("2024.2");
        assertThat(metadata.get("gridSystem").asText()).isEqualTo("h3");
        assertThat(metadata.get("successful").asBoolean()).isTrue();
        assertThat(metadata.get("dataVersion").asText()).matches("\\d{8}-\\d{6}");
    }

    @Test
    void testRebuildIsSkippedAndIdentical() throws IOException {
        orchestrator.build(new BuildRequest(List.of(4), true, false));
        byte[] cells = Files.readAllBytes(layout.cellEvents("h3", 4));
        byte[] municipalities = Files.readAllBytes(layout.municipalityEvents());

        BuildReport second = orchestrator.build(new BuildRequest(List.of(4), true, false));

        assertThat(second.targets()).flatExtracting(TargetReport::stages).extracting(StageOutcome::status)
                .containsOnly(StageStatus.UP_TO_DATE);
        assertThat(Files.readAllBytes(layout.cellEvents("h3", 4))).isEqualTo(cells);

        BuildReport forced = orchestrator.build(new BuildRequest(List.of(4), true, true));

        assertThat(forced.targets()).flatExtracting(TargetReport::stages).extracting(StageOutcome::status)
                .containsOnly(StageStatus.BUILT);
        assertThat(Files.readAllBytes(layout.cellEvents("h3", 4))).isEqualTo(cells);
        assertThat(Files.readAllBytes(layout.municipalityEvents())).isEqualTo(municipalities);
    }

    @Test
    void testFailingTargetDoesNotStopOthers() {
        BuildReport report = orchestrator.build(new BuildRequest(List.of(5, 99), false, false));

        assertThat(report.isSuccessful()).isFalse();
        assertThat(report.failedTargets()).extracting(TargetReport::target).containsExactly("h3_r99");
        TargetReport failed = report.target("h3_r99");
        assertThat(failed.stage("population-r99").status()).isEqualTo(StageStatus.FAILED);
        assertThat(failed.stage("events-r99").status()).isEqualTo(StageStatus.SKIPPED);
        assertThat(failed.stage("features-r99").status()).isEqualTo(StageStatus.SKIPPED);
        assertThat(report.target("h3_r5").isSuccessful()).isTrue();
        assertThat(Files.exists(layout.cellEvents("h3", 99))).isFalse();
    }

    @Test
    void testRepeatedResolutionIsOneTarget() {
        BuildRequest request = new BuildRequest(List.of(5, 5, 5, 5), false, true);

        assertThat(request.resolutions()).containsExactly(5);
        for (int run = 0; run < 3; run++) {
            BuildReport report = orchestrator.build(request);

            assertThat(report.isSuccessful()).isTrue();
            assertThat(report.targets()).extracting(TargetReport::target).containsExactly("h3_r5");
        }
        assertThat(Files.exists(AtomicFiles.tempSibling(layout.cellEvents("h3", 5)))).isFalse();
    }

    @Test
    void testMissingIncidentsFailsBeforeWriting() throws IOException {
        Files.delete(layout.incidents());

        BuildReport report = orchestrator.build(new BuildRequest(List.of(5), false, false));

        TargetReport target = report.target("h3_r5");
        assertThat(target.stage("population-r5").status()).isEqualTo(StageStatus.BUILT);
        assertThat(target.stage("events-r5").status()).isEqualTo(StageStatus.FAILED);
        assertThat(target.error()).contains("events.csv");
        assertThat(Files.exists(layout.cellEvents("h3", 5))).isFalse();
    }

    @Test
    void testStatisticsFollowTheRun() {
        BuildStatistics stats = new BuildStatistics();
        BuildRequest request = new BuildRequest(List.of(5), true, false);

        BuildReport report = orchestrator.run(factory.targets(request, stats), false, stats);

        assertThat(report.isSuccessful()).isTrue();
        assertThat(stats.getStagesBuilt()).isEqualTo(5);
        assertThat(stats.getStagesFailed()).isZero();
        assertThat(stats.getRecordsRead()).isEqualTo(14);
        assertThat(stats.getRecordsExcluded()).isEqualTo(3);
        assertThat(stats.getRecordsUnmapped()).isEqualTo(2);
        assertThat(stats.getRecordsAggregated()).isEqualTo(9);
        assertThat(stats.getPopulationCells()).isEqualTo(2);
        assertThat(stats.getFeaturesExported()).isEqualTo(4);
        assertThat(stats.getFeaturesWithoutBoundary()).isEqualTo(1);

        BuildReport again = orchestrator.run(factory.targets(request, stats), false, stats);

        assertThat(again.isSuccessful()).isTrue();
        assertThat(stats.getStagesUpToDate()).isEqualTo(5);
    }

    private String cellOf(double lat, double lon) {
        return indexer.cellForPoint(lat, lon, 5).map(SpatialCell::id).orElseThrow();
    }

    private void writeInputs() throws IOException {
        Files.writeString(layout.incidents(), String.join("\n",
                "id,datetime,name,summary,url,type,location_name,latitude,longitude",
                incident(1, "Stöld", "Stockholm", STOCKHOLM_LAT, STOCKHOLM_LON),
                incident(2, "Stöld", "Stockholm", STOCKHOLM_LAT, STOCKHOLM_LON),
                incident(3, "Stöld", "Stockholm", STOCKHOLM_LAT, STOCKHOLM_LON),
                incident(4, "Misshandel", "Uppsala", UPPSALA_LAT, UPPSALA_LON),
                incident(5, "Rån", "Stockholms län", STOCKHOLM_LAT, STOCKHOLM_LON),
                incident(6, "Sammanfattning natt", "Stockholm", STOCKHOLM_LAT, STOCKHOLM_LON),
                "7,2024-05-01 12:00:00,,,,Stöld,Solna,,",
                ""));

        Files.createDirectories(layout.populationGrid().getParent());
        Files.writeString(layout.populationGrid(), String.join("\n",
                "geometry,population,female,male",
                gridRow(STOCKHOLM_LAT, STOCKHOLM_LON, 2000),
                gridRow(UPPSALA_LAT, UPPSALA_LON, 50),
                ""));

        Files.createDirectories(layout.municipalityCatalog().getParent());
        Files.writeString(layout.municipalityCatalog(), String.join("\n",
                "code,name,population",
                "0180,Stockholm,984748",
                "0380,Uppsala,242140",
                "2418,Malå,3040",
                ""));

        Files.writeString(layout.municipalityBoundaries(), """
                {"type": "FeatureCollection", "features": [
                  {"type": "Feature", "properties": {"id": "0180"},
                   "geometry": {"type": "Polygon", "coordinates": [[[17.8, 59.2], [18.2, 59.2], [18.2, 59.4], [17.8, 59.2]]]}},
                  {"type": "Feature", "properties": {"id": "0380"},
                   "geometry": {"type": "Polygon", "coordinates": [[[17.4, 59.7], [17.9, 59.7], [17.9, 60.0], [17.4, 59.7]]]}}
                ]}
                """);
    }

    private static String incident(int id, String type, String location, double lat, double lon) {
        return String.format(Locale.ROOT, "%d,2024-05-01 10:00:00,,,/aktuellt/%d,%s,%s,%.4f,%.4f", id, id, type, location, lat, lon);
    }

    private static String gridRow(double lat, double lon, long population) {
        double[] center = TransverseMercatorReprojector.sweref99Tm().fromGeodetic(lat, lon);
        double e = center[0] - 500;
        double n = center[1] - 500;
        return String.format(Locale.ROOT, "\"POLYGON ((%.3f %.3f, %.3f %.3f, %.3f %.3f, %.3f %.3f, %.3f %.3f))\",%d,%d,%d",
                e, n, e + 1000, n, e + 1000, n + 1000, e, n + 1000, e, n,
                population, population / 2, population - population / 2);
    }
}
