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
import java.util.Optional;

/**
 * The fixed incident taxonomy. Every raw incident type maps to exactly one of these.
 */
public enum Category {
    TRAFFIC("traffic"),
    PROPERTY("property"),
    VIOLENCE("violence"),
    NARCOTICS("narcotics"),
    FRAUD("fraud"),
    PUBLIC_ORDER("public_order"),
    WEAPONS("weapons"),
    OTHER("other");

    private final String key;

    Category(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Name of the count column in aggregated tables and feature properties.
     */
    public String columnName() {
        return key + "_count";
    }

    public static Optional<Category> fromKey(String key) {
        return Arrays.stream(values())
                .filter(c -> c.key.equals(key))
                .findFirst();
    }
}
