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

import com.dedicatedcode.crimecity.exception.AtomicWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Outputs are written next to their final location and renamed over it in one step,
 * so readers see either the previous or the new version, never a partial file.
 */
public final class AtomicFiles {

    private static final Logger logger = LoggerFactory.getLogger(AtomicFiles.class);

    private AtomicFiles() {
    }

    @FunctionalInterface
    public interface Writer {
        void write(Path target) throws IOException;
    }

    public static Path tempSibling(Path target) {
        return target.resolveSibling(target.getFileName() + ".tmp");
    }

    /**
     * Renames {@code temp} over {@code target}. On failure the temp file is removed and the
     * previous target is left in place.
     */
    public static void publish(Path temp, Path target) {
        try {
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.warn("Atomic move not supported for {}, falling back to replace", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new AtomicWriteException(target, e);
        }
    }

    /**
     * Writes through a temp sibling and publishes the result.
     */
    public static void write(Path target, Writer writer) throws IOException {
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Path temp = tempSibling(target);
        try {
            writer.write(temp);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(temp);
            throw e;
        }
        publish(temp, target);
    }

    static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not remove temporary file {}: {}", path, e.getMessage());
        }
    }
}
