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
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;

/**
 * Newline-delimited GeoJSON, one feature per line, optionally gzip compressed.
 */
public class GeoJsonLinesFeatureSink implements FeatureSink {

    private final ObjectMapper objectMapper;
    private final BufferedWriter writer;
    private long written;

    public GeoJsonLinesFeatureSink(Path target, boolean compress, ObjectMapper objectMapper) throws IOException {
        this.objectMapper = objectMapper;
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        OutputStream out = Files.newOutputStream(target);
        if (compress) {
            try {
                out = new GZIPOutputStream(out, 64 * 1024);
            } catch (IOException | RuntimeException e) {
                out.close();
                throw e;
            }
        }
        this.writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8), 64 * 1024);
    }

    @Override
    public void accept(GeoJsonFeature feature) throws IOException {
        writer.write(objectMapper.writeValueAsString(feature));
        writer.write('\n');
        written++;
    }

    public long written() {
        return written;
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
