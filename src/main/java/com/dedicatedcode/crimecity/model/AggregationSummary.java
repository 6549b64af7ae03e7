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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Conservation diagnostics of one aggregation run.
 * <p>
 * {@code qualifying = input - excluded} and {@code qualifying = aggregated + unmapped}.
 */
public record AggregationSummary(@JsonProperty("inputRecords") long inputRecords,
                                 @JsonProperty("excludedRecords") long excludedRecords,
                                 @JsonProperty("unmappedRecords") long unmappedRecords,
                                 @JsonProperty("aggregatedRecords") long aggregatedRecords,
                                 @JsonProperty("units") long units,
                                 @JsonProperty("unitsWithoutPopulation") long unitsWithoutPopulation) {

    public long qualifyingRecords() {
        return inputRecords - excludedRecords;
    }

    @JsonIgnore
    public boolean isConserved() {
        return aggregatedRecords + unmappedRecords == qualifyingRecords();
    }

    public AggregationSummary withUnits(long units, long unitsWithoutPopulation) {
        return new AggregationSummary(inputRecords, excludedRecords, unmappedRecords, aggregatedRecords, units, unitsWithoutPopulation);
    }
}
