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

import com.dedicatedcode.crimecity.model.PopulationCount;

import java.util.List;

/**
 * Population per cell for one resolution, sorted by cell id.
 *
 * @param cells           cells with population above zero
 * @param gridRows        grid rows read
 * @param unmappableRows  rows with population whose centroid did not fall into any cell
 * @param emptyRows       rows skipped because their population was zero or less
 */
public record PopulationConversion(List<PopulationCount> cells, long gridRows, long unmappableRows, long emptyRows) {

    public PopulationConversion {
        cells = List.copyOf(cells);
    }

    public long totalPopulation() {
        return cells.stream().mapToLong(PopulationCount::population).sum();
    }
}
