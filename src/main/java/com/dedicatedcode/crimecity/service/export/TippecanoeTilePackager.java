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

import com.dedicatedcode.crimecity.exception.TilePackagingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs tippecanoe to produce PMTiles from GeoJSON features.
 */
public class TippecanoeTilePackager implements TilePackager {

    private static final Logger logger = LoggerFactory.getLogger(TippecanoeTilePackager.class);
    private static final int MAX_REPORTED_LINES = 20;

    private final String binary;

    public TippecanoeTilePackager(String binary) {
        this.binary = binary;
    }

    @Override
    public void pack(Path features, Path output, TilingOptions options) {
        if (!Files.isRegularFile(features)) {
            throw new TilePackagingException("Feature file not found: " + features);
        }
        List<String> command = buildCommand(features, output, options);
        logger.info("Packing layer {} (zoom {}-{}) into {}", options.layer(), options.minZoom(), options.maxZoom(), output);
        logger.debug("Running {}", String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new TilePackagingException("Could not start '" + binary + "', is tippecanoe installed and on the PATH?", e);
        }

        List<String> tail = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                logger.debug("tippecanoe: {}", line);
                tail.add(line);
                if (tail.size() > MAX_REPORTED_LINES) {
                    tail.remove(0);
                }
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new TilePackagingException("tippecanoe exited with code " + exitCode + " for layer "
                        + options.layer() + ":\n" + String.join("\n", tail));
            }
        } catch (IOException e) {
            process.destroyForcibly();
            throw new TilePackagingException("Failed reading tippecanoe output", e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new TilePackagingException("Interrupted while waiting for tippecanoe", e);
        }
    }

    public List<String> buildCommand(Path features, Path output, TilingOptions options) {
        List<String> command = new ArrayList<>();
        command.add(binary);
        command.add("-o");
        command.add(output.toString());
        command.add("--layer=" + options.layer());
        command.add("--minimum-zoom=" + options.minZoom());
        command.add("--maximum-zoom=" + options.maxZoom());
        command.add("--simplification=10");
        command.add("--force");
        if (options.featureLimit()) {
            command.add("--maximum-tile-features=10000");
            command.add("--drop-densest-as-needed");
            command.add("--extend-zooms-if-still-dropping");
        } else {
            command.add("--no-feature-limit");
            command.add("--no-tile-size-limit");
        }
        String name = features.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".geojsonl") || name.endsWith(".gz")) {
            command.add("-P");
        }
        for (String attribute : options.attributes()) {
            command.add("--include=" + attribute);
        }
        command.add(features.toString());
        return command;
    }
}
