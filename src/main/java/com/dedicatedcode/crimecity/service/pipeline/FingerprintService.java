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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * SHA-256 fingerprints of stages: name, sorted parameters and the content of every input.
 * File digests are cached by path, size and modification time.
 */
@Service
public class FingerprintService {

    private final Cache<FileKey, String> digests = Caffeine.newBuilder()
            .maximumSize(1_000)
            .build();

    public String fingerprint(BuildStage stage) {
        MessageDigest digest = sha256();
        update(digest, "stage=" + stage.name() + "\n");
        for (Map.Entry<String, String> parameter : new TreeMap<>(stage.parameters()).entrySet()) {
            update(digest, parameter.getKey() + "=" + parameter.getValue() + "\n");
        }
        for (Path input : stage.inputs()) {
            update(digest, "input=" + input.getFileName() + ":" + digest(input) + "\n");
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Hex SHA-256 of a file's content.
     */
    public String digest(Path file) {
        try {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            FileKey key = new FileKey(file.toAbsolutePath().normalize(), attributes.size(), attributes.lastModifiedTime().toMillis());
            return digests.get(key, k -> computeDigest(k.path()));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
    }

    /**
     * Forgets cached digests of a file that was just rewritten.
     */
    public void invalidate(Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        digests.asMap().keySet().removeIf(key -> key.path().equals(normalized));
    }

    private static String computeDigest(Path file) {
        MessageDigest digest = sha256();
        byte[] buffer = new byte[64 * 1024];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static void update(MessageDigest digest, String value) {
        digest.update(value.getBytes(StandardCharsets.UTF_8));
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private record FileKey(Path path, long size, long modified) {
    }
}
