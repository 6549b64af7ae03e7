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
import java.util.Objects;

/**
 * One row of an aggregated table: counts of a spatial unit joined with its population.
 * <p>
 * {@code totalCount == sum(categories) == sum(subtypes.count)} is checked on construction.
 */
public final class AggregatedUnit {

    private final String key;
    private final String name;
    private final String dominantLocation;
    private final long totalCount;
    private final CategoryCounts categories;
    private final List<SubtypeCount> subtypes;
    private final long population;
    private final double ratePer10000;
    private final boolean lowReliability;

    public AggregatedUnit(String key,
                          String name,
                          String dominantLocation,
                          long totalCount,
                          CategoryCounts categories,
                          List<SubtypeCount> subtypes,
                          long population,
                          double ratePer10000,
                          boolean lowReliability) {
        this.key = Objects.requireNonNull(key, "key");
        this.name = name;
        this.dominantLocation = dominantLocation;
        this.totalCount = totalCount;
        this.categories = Objects.requireNonNull(categories, "categories");
        this.subtypes = List.copyOf(subtypes);
        this.population = population;
        this.ratePer10000 = ratePer10000;
        this.lowReliability = lowReliability;

        long subtypeTotal = this.subtypes.stream().mapToLong(SubtypeCount::count).sum();
        if (categories.total() != totalCount || subtypeTotal != totalCount) {
            throw new IllegalStateException(String.format(
                    "Unit %s does not reconcile: total=%d categories=%d subtypes=%d",
                    key, totalCount, categories.total(), subtypeTotal));
        }
    }

    public String getKey() {
        return key;
    }

    public String getName() {
        return name;
    }

    public String getDominantLocation() {
        return dominantLocation;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public CategoryCounts getCategories() {
        return categories;
    }

    public List<SubtypeCount> getSubtypes() {
        return subtypes;
    }

    public long getPopulation() {
        return population;
    }

    public double getRatePer10000() {
        return ratePer10000;
    }

    public boolean isLowReliability() {
        return lowReliability;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregatedUnit that)) return false;
        return totalCount == that.totalCount
                && population == that.population
                && Double.compare(that.ratePer10000, ratePer10000) == 0
                && lowReliability == that.lowReliability
                && key.equals(that.key)
                && Objects.equals(name, that.name)
                && Objects.equals(dominantLocation, that.dominantLocation)
                && categories.equals(that.categories)
                && subtypes.equals(that.subtypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, name, dominantLocation, totalCount, categories, subtypes, population, ratePer10000, lowReliability);
    }

    @Override
    public String toString() {
        return "AggregatedUnit{" +
                "key='" + key + '\'' +
                ", totalCount=" + totalCount +
                ", population=" + population +
                ", ratePer10000=" + ratePer10000 +
                ", lowReliability=" + lowReliability +
                '}';
    }
}
