package com.dedicatedcode.crimecity.service.pipeline;

import com.dedicatedcode.crimecity.config.CrimeCityConfiguration;
import com.dedicatedcode.crimecity.exception.PipelineException;
import com.dedicatedcode.crimecity.service.classification.CategoryClassifier;
import com.dedicatedcode.crimecity.service.spatial.SpatialIndexer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs build targets concurrently, the stages of each target in order.
 * A failing stage stops its own target; the other targets carry on.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final CrimeCityConfiguration config;
    private final BuildTargetFactory targetFactory;
    private final StageRunner stageRunner;
    private final SpatialIndexer indexer;
    private final CategoryClassifier classifier;
    private final ObjectMapper objectMapper;

    public PipelineOrchestrator(CrimeCityConfiguration config,
                                BuildTargetFactory targetFactory,
                                StageRunner stageRunner,
                                SpatialIndexer indexer,
                                CategoryClassifier classifier,
                                ObjectMapper objectMapper) {
        this.config = config;
        this.targetFactory = targetFactory;
        this.stageRunner = stageRunner;
        this.indexer = indexer;
        this.classifier = classifier;
        this.objectMapper = objectMapper;
    }

    public BuildReport build(BuildRequest request) {
        BuildStatistics stats = new BuildStatistics();
        List<BuildTarget> targets = targetFactory.targets(request, stats);
        stats.printPhaseHeader(String.format("Building %d targets (%s resolutions %s%s) into %s",
                targets.size(), indexer.name(), request.resolutions(),
                request.municipalities() ? " + municipalities" : "", config.getDataDir()));

        BuildReport report = run(targets, request.force(), stats);

        try {
            writeMetadataFile(DataLayout.of(config), request, report);
        } catch (IOException e) {
            throw new PipelineException("Could not write build metadata", e);
        }
        stats.printFinalStatistics(report);
        if (report.isSuccessful()) {
            stats.printSuccess();
        } else {
            stats.printError("BUILD FAILED: " + report.failedTargets().size() + " of " + targets.size() + " targets");
        }
        return report;
    }

    public BuildReport run(List<BuildTarget> targets, boolean force, BuildStatistics stats) {
        if (targets.isEmpty()) {
            return new BuildReport(List.of());
        }
        int threads = Math.max(1, Math.min(config.getPipeline().getThreads(), targets.size()));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<TargetReport>> futures = new ArrayList<>();
            for (BuildTarget target : targets) {
                futures.add(executor.submit(() -> runTarget(target, force, stats)));
            }
            List<TargetReport> reports = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    reports.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    logger.error("Target {} crashed", targets.get(i).name(), e.getCause());
                    reports.add(new TargetReport(targets.get(i).name(), List.of(), String.valueOf(e.getCause())));
                }
            }
            return new BuildReport(reports);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("Build interrupted", e);
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    TargetReport runTarget(BuildTarget target, boolean force, BuildStatistics stats) {
        List<StageOutcome> outcomes = new ArrayList<>();
        String error = null;
        for (BuildStage stage : target.stages()) {
            StageOutcome outcome;
            if (error != null) {
                outcome = StageOutcome.skipped(stage.name());
            } else {
                long start = System.currentTimeMillis();
                try {
                    outcome = stageRunner.run(stage, force);
                } catch (RuntimeException e) {
                    error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                    logger.error("Target {} failed in stage {}: {}", target.name(), stage.name(), error, e);
                    outcome = new StageOutcome(stage.name(), StageStatus.FAILED, System.currentTimeMillis() - start, error);
                }
            }
            stats.recordOutcome(outcome);
            outcomes.add(outcome);
        }
        if (error == null) {
            logger.info("Target {} completed", target.name());
        }
        return new TargetReport(target.name(), outcomes, error);
    }

    private void writeMetadataFile(DataLayout layout, BuildRequest request, BuildReport report) throws IOException {
        Path metadataPath = layout.metadata();
        Files.createDirectories(layout.dataDir());
        Instant now = Instant.now();
        String buildTimestamp = DateTimeFormatter.ISO_INSTANT.format(now);
        String dataVersion = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC).format(now);
        String version = PipelineOrchestrator.class.getPackage().getImplementationVersion();
        BuildMetadata metadata = new BuildMetadata(
                buildTimestamp,
                dataVersion,
                layout.incidents().getFileName().toString(),
                indexer.name(),
                request.resolutions(),
                classifier.version(),
                report.isSuccessful(),
                version != null ? version : "1.0.0-SNAPSHOT"
        );
        AtomicFiles.write(metadataPath, target -> objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), metadata));
        logger.info("Metadata file written to {}", metadataPath);
    }
}
