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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;

/**
 * Number of incidents of one raw type within a spatial unit.
 */
public record SubtypeCount(@JsonProperty("type") String subtype,
                           @JsonProperty("count") long count) {

    /**
     * Count descending, label ascending on ties.
     */
    public static final Comparator<SubtypeCount> ORDER = Comparator
            .comparingLong(SubtypeCount::count).reversed()
            .thenComparing(SubtypeCount::subtype);
}
