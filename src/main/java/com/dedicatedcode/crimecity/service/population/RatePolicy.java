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

package com.dedicatedcode.crimecity.service.population;

/**
 * Incidents per 10 000 inhabitants and whether the denominator is too small to trust.
 */
public final class RatePolicy {

    public static final double PER_INHABITANTS = 10_000.0;

    private RatePolicy() {
    }

    /**
     * Without population there is nothing to normalize by and the rate is 0.
     */
    public static double ratePer10000(long totalCount, long population) {
        if (population <= 0) {
            return 0.0;
        }
        return totalCount / (double) population * PER_INHABITANTS;
    }

    public static boolean isLowReliability(long population, long minPopulation) {
        return population <= 0 || population < minPopulation;
    }
}
