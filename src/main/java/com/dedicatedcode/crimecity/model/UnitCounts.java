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

import java.util.List;

/**
 * Aggregated incident counts of one spatial key before population is joined.
 *
 * @param key              cell id or catalog unit code
 * @param categories       the eight category counters
 * @param subtypes         sparse subtype counts, sorted by {@link SubtypeCount#ORDER}
 * @param dominantLocation most frequent location name, null when not tracked
 */
public record UnitCounts(String key, CategoryCounts categories, List<SubtypeCount> subtypes, String dominantLocation) {

    public UnitCounts {
        subtypes = List.copyOf(subtypes);
        long subtypeTotal = subtypes.stream().mapToLong(SubtypeCount::count).sum();
        if (subtypeTotal != categories.total()) {
            throw new IllegalStateException("Counts of " + key + " do not reconcile: categories="
                    + categories.total() + " subtypes=" + subtypeTotal);
        }
    }

    public static UnitCounts empty(String key) {
        return new UnitCounts(key, CategoryCounts.EMPTY, List.of(), null);
    }

    public long total() {
        return categories.total();
    }
}
