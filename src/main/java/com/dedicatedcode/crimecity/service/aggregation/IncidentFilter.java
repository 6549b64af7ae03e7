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

import com.dedicatedcode.crimecity.config.CrimeCityConfiguration;
import com.dedicatedcode.crimecity.model.IncidentRecord;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Removes records that are not incidents before they reach the aggregation:
 * editorial summaries by raw type and, on the municipality path, county level reports by location.
 * Patterns must match the whole value.
 */
public class IncidentFilter {

    private final List<Pattern> typePatterns;
    private final List<Pattern> locationPatterns;

    public IncidentFilter(List<String> typePatterns, List<String> locationPatterns) {
        this.typePatterns = compile(typePatterns);
        this.locationPatterns = compile(locationPatterns);
    }

    public static IncidentFilter forCells(CrimeCityConfiguration.AggregationConfiguration config) {
        return new IncidentFilter(config.getExcludedTypePatterns(), List.of());
    }

    public static IncidentFilter forCatalog(CrimeCityConfiguration.AggregationConfiguration config) {
        return new IncidentFilter(config.getExcludedTypePatterns(), config.getExcludedLocationPatterns());
    }

    public boolean isExcluded(IncidentRecord record) {
        return matchesAny(typePatterns, record.type()) || matchesAny(locationPatterns, record.locationName());
    }

    /**
     * The active patterns, as declared in stage fingerprints.
     */
    public String describe() {
        return "types=" + join(typePatterns) + ";locations=" + join(locationPatterns);
    }

    private static boolean matchesAny(List<Pattern> patterns, String value) {
        if (value == null) {
            return false;
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(value).matches()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compile(List<String> patterns) {
        return patterns == null ? List.of() : patterns.stream().map(Pattern::compile).toList();
    }

    private static String join(List<Pattern> patterns) {
        return patterns.stream().map(Pattern::pattern).collect(Collectors.joining(",", "[", "]"));
    }
}
