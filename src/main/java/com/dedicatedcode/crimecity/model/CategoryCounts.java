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

package com.dedicatedcode.crimecity.model;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable counters for the eight categories.
 */
public final class CategoryCounts {

    public static final CategoryCounts EMPTY = new CategoryCounts(new long[Category.values().length]);

    private final long[] counts;

    private CategoryCounts(long[] counts) {
        this.counts = counts;
    }

    public static CategoryCounts of(Map<Category, Long> values) {
        long[] counts = new long[Category.values().length];
        values.forEach((category, count) -> {
            if (count < 0) {
                throw new IllegalArgumentException("Negative count for " + category + ": " + count);
            }
            counts[category.ordinal()] = count;
        });
        return new CategoryCounts(counts);
    }

    public long get(Category category) {
        return counts[category.ordinal()];
    }

    public long total() {
        long sum = 0;
        for (long c : counts) {
            sum += c;
        }
        return sum;
    }

    public Map<Category, Long> asMap() {
        Map<Category, Long> map = new EnumMap<>(Category.class);
        for (Category category : Category.values()) {
            map.put(category, counts[category.ordinal()]);
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CategoryCounts other)) return false;
        return Arrays.equals(counts, other.counts);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(counts);
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
