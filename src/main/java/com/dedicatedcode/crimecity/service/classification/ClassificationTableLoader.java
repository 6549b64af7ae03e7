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

package com.dedicatedcode.crimecity.service.classification;

import com.dedicatedcode.crimecity.exception.InputMissingException;
import com.dedicatedcode.crimecity.exception.SchemaMismatchException;
import com.dedicatedcode.crimecity.model.Category;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Reads the event type table:
 * <pre>
 * {
 *   "version": "2024.2",
 *   "event_types": { "Stöld": "property", ... },
 *   "unresolved": [ "Skottlossning", ... ]
 * }
 * </pre>
 * Duplicate raw types and unknown categories are rejected.
 */
@Service
public class ClassificationTableLoader {

    private static final Logger logger = LoggerFactory.getLogger(ClassificationTableLoader.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
            .build();

    @Autowired
    public ClassificationTableLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    public ClassificationTableLoader() {
        this(new DefaultResourceLoader());
    }

    /**
     * Loads the table from a Spring resource location ("classpath:event_types.json", "file:/etc/...").
     */
    public ClassificationTable load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new InputMissingException(Path.of(location.replaceFirst("^(classpath|file):", "")));
        }
        try (InputStream in = resource.getInputStream()) {
            ClassificationTable table = parse(in.readAllBytes(), location);
            logger.info("Loaded classification table {} (version {}, {} types, {} unresolved)",
                    location, table.version(), table.categories().size(), table.unresolved().size());
            return table;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read classification table " + location, e);
        }
    }

    ClassificationTable parse(byte[] content, String source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new SchemaMismatchException(source, "event_types", e.getOriginalMessage());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (root == null || !root.hasNonNull("version")) {
            throw new SchemaMismatchException(source, "version");
        }
        JsonNode types = root.get("event_types");
        if (types == null || !types.isObject()) {
            throw new SchemaMismatchException(source, "event_types");
        }

        Map<String, Category> categories = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = types.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String categoryKey = entry.getValue().asText();
            Category category = Category.fromKey(categoryKey)
                    .orElseThrow(() -> new SchemaMismatchException(source, "event_types." + entry.getKey(),
                            "unknown category '" + categoryKey + "'"));
            categories.put(entry.getKey(), category);
        }

        Set<String> unresolved = new HashSet<>();
        JsonNode unresolvedNode = root.get("unresolved");
        if (unresolvedNode != null) {
            for (JsonNode node : unresolvedNode) {
                String type = node.asText();
                Category mapped = categories.get(type);
                if (mapped != null && mapped != Category.OTHER) {
                    throw new SchemaMismatchException(source, "unresolved." + type,
                            "pending types must stay in category 'other', found '" + mapped.key() + "'");
                }
                unresolved.add(type);
            }
        }
        return new ClassificationTable(root.get("version").asText(), sha256(content), categories, unresolved);
    }

    private static String sha256(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
