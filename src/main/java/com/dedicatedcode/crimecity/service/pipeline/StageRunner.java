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

import com.dedicatedcode.crimecity.exception.InputMissingException;
import com.dedicatedcode.crimecity.exception.PipelineException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Runs a single stage: verifies its inputs, skips it when its output is current and otherwise
 * rebuilds and publishes the output together with a new manifest.
 */
@Service
public class StageRunner {

    private static final Logger logger = LoggerFactory.getLogger(StageRunner.class);

    private final FingerprintService fingerprints;
    private final ObjectMapper objectMapper;

    public StageRunner(FingerprintService fingerprints, ObjectMapper objectMapper) {
        this.fingerprints = fingerprints;
        this.objectMapper = objectMapper;
    }

    /**
     * @throws InputMissingException if a declared input does not exist; the output is not touched
     * @throws PipelineException     if building or publishing fails; a previous output stays in place
     */
    public StageOutcome run(BuildStage stage, boolean force) {
        long start = System.currentTimeMillis();
        for (Path input : stage.inputs()) {
            if (!Files.exists(input)) {
                throw new InputMissingException(stage.name(), input);
            }
        }

        String fingerprint = fingerprints.fingerprint(stage);
        Path output = stage.output();
        if (!force && isUpToDate(output, fingerprint)) {
            logger.info("Stage {} is up to date", stage.name());
            return new StageOutcome(stage.name(), StageStatus.UP_TO_DATE, System.currentTimeMillis() - start, null);
        }

        logger.info("Building stage {} -> {}", stage.name(), output);
        Path temp = AtomicFiles.tempSibling(output);
        try {
            if (output.getParent() != null) {
                Files.createDirectories(output.getParent());
            }
            Files.deleteIfExists(temp);
            stage.build(temp);
        } catch (IOException e) {
            AtomicFiles.deleteQuietly(temp);
            throw new PipelineException("Stage '" + stage.name() + "' failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            AtomicFiles.deleteQuietly(temp);
            throw e;
        }
        AtomicFiles.publish(temp, output);
        fingerprints.invalidate(output);

        try {
            stage.afterPublish(output);
            StageManifest manifest = new StageManifest(stage.name(), fingerprint,
                    stage.inputs().stream().map(Path::toString).toList(),
                    new TreeMap<>(stage.parameters()));
            AtomicFiles.write(StageManifest.pathFor(output),
                    target -> objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), manifest));
        } catch (IOException e) {
            throw new PipelineException("Stage '" + stage.name() + "' could not write its sidecar files: " + e.getMessage(), e);
        }

        long duration = System.currentTimeMillis() - start;
        logger.info("Stage {} built in {} ms", stage.name(), duration);
        return new StageOutcome(stage.name(), StageStatus.BUILT, duration, null);
    }

    private boolean isUpToDate(Path output, String fingerprint) {
        if (!Files.isRegularFile(output)) {
            return false;
        }
        return readManifest(output)
                .map(manifest -> fingerprint.equals(manifest.fingerprint()))
                .orElse(false);
    }

    Optional<StageManifest> readManifest(Path output) {
        Path manifestPath = StageManifest.pathFor(output);
        if (!Files.isRegularFile(manifestPath)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(manifestPath.toFile(), StageManifest.class));
        } catch (IOException e) {
            logger.warn("Ignoring unreadable manifest {}: {}", manifestPath, e.getMessage());
            return Optional.empty();
        }
    }
}
