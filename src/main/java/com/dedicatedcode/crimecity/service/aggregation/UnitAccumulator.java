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

package com.dedicatedcode.crimecity.service.aggregation;

import com.dedicatedcode.crimecity.model.Category;
import com.dedicatedcode.crimecity.model.CategoryCounts;
import com.dedicatedcode.crimecity.model.SubtypeCount;
import com.dedicatedcode.crimecity.model.UnitCounts;
import com.dedicatedcode.crimecity.service.classification.CategoryClassifier;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Partial counts of one chunk of incidents. Merging is associative and commutative,
 * so the result does not depend on how records were split into chunks.
 */
final class UnitAccumulator {

    private final Map<String, Map<String, Long>> subtypesByKey = new HashMap<>();
    private final Map<String, Map<String, Long>> locationsByKey = new HashMap<>();
    long input;
    long excluded;
    long unmapped;
    long aggregated;

    void add(String key, String rawType, String locationName) {
        subtypesByKey.computeIfAbsent(key, k -> new HashMap<>()).merge(rawType == null ? "" : rawType, 1L, Long::sum);
        if (locationName != null && !locationName.isBlank()) {
            locationsByKey.computeIfAbsent(key, k -> new HashMap<>()).merge(locationName, 1L, Long::sum);
        }
        aggregated++;
    }

    UnitAccumulator merge(UnitAccumulator other) {
        other.subtypesByKey.forEach((key, counts) -> {
            Map<String, Long> target = subtypesByKey.computeIfAbsent(key, k -> new HashMap<>());
            counts.forEach((type, count) -> target.merge(type, count, Long::sum));
        });
        other.locationsByKey.forEach((key, counts) -> {
            Map<String, Long> target = locationsByKey.computeIfAbsent(key, k -> new HashMap<>());
            counts.forEach((name, count) -> target.merge(name, count, Long::sum));
        });
        input += other.input;
        excluded += other.excluded;
        unmapped += other.unmapped;
        aggregated += other.aggregated;
        return this;
    }

    /**
     * Rolls the subtype counts up into categories, one {@link UnitCounts} per key in key order.
     */
    List<UnitCounts> finish(CategoryClassifier classifier) {
        List<UnitCounts> units = new ArrayList<>(subtypesByKey.size());
        for (Map.Entry<String, Map<String, Long>> entry : new TreeMap<>(subtypesByKey).entrySet()) {
            Map<Category, Long> categories = new EnumMap<>(Category.class);
            List<SubtypeCount> subtypes = new ArrayList<>(entry.getValue().size());
            entry.getValue().forEach((type, count) -> {
                categories.merge(classifier.classify(type), count, Long::sum);
                subtypes.add(new SubtypeCount(type, count));
            });
            subtypes.sort(SubtypeCount.ORDER);
            units.add(new UnitCounts(entry.getKey(), CategoryCounts.of(categories), subtypes,
                    dominantLocation(locationsByKey.get(entry.getKey()))));
        }
        return units;
    }

    private static String dominantLocation(Map<String, Long> locations) {
        if (locations == null || locations.isEmpty()) {
            return null;
        }
        return locations.entrySet().stream()
                .min(Comparator.<Map.Entry<String, Long>>comparingLong(Map.Entry::getValue).reversed()
                        .thenComparing(Map.Entry::getKey))
                .map(Map.Entry::getKey)
                .orElse(null);
    }
}
