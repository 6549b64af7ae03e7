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

import com.dedicatedcode.crimecity.model.AdministrativeUnit;
import com.dedicatedcode.crimecity.model.AggregatedUnit;
import com.dedicatedcode.crimecity.model.PopulationCount;
import com.dedicatedcode.crimecity.model.UnitCounts;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Attaches population to aggregated counts. The two directions are kept apart:
 * cells are driven by their events, catalog units by the catalog.
 */
public class PopulationJoiner {

    /**
     * Left outer join from the counted cells to the population table. Cells without population
     * keep their counts, with population 0 and rate 0.
     */
    public List<AggregatedUnit> joinByCell(Collection<UnitCounts> units,
                                           Map<String, PopulationCount> populationByCell,
                                           long minPopulation) {
        List<AggregatedUnit> joined = new ArrayList<>(units.size());
        for (UnitCounts unit : units) {
            PopulationCount population = populationByCell.get(unit.key());
            long inhabitants = population == null ? 0 : population.population();
            joined.add(toAggregated(unit, null, unit.dominantLocation(), inhabitants, minPopulation));
        }
        return joined;
    }

    /**
     * Left outer join from the catalog to the counted units. Every catalog unit is returned
     * exactly once, with zero counts when it had no incidents.
     */
    public List<AggregatedUnit> joinByCatalog(List<AdministrativeUnit> catalog,
                                              Collection<UnitCounts> units,
                                              long minPopulation) {
        Map<String, UnitCounts> countsByCode = new HashMap<>();
        for (UnitCounts unit : units) {
            countsByCode.put(unit.key(), unit);
        }
        List<AggregatedUnit> joined = new ArrayList<>(catalog.size());
        for (AdministrativeUnit unit : catalog) {
            UnitCounts counts = countsByCode.getOrDefault(unit.code(), UnitCounts.empty(unit.code()));
            joined.add(toAggregated(counts, unit.name(), null, unit.population(), minPopulation));
        }
        return joined;
    }

    private static AggregatedUnit toAggregated(UnitCounts counts, String name, String dominantLocation,
                                               long population, long minPopulation) {
        return new AggregatedUnit(
                counts.key(),
                name,
                dominantLocation,
                counts.total(),
                counts.categories(),
                counts.subtypes(),
                population,
                RatePolicy.ratePer10000(counts.total(), population),
                RatePolicy.isLowReliability(population, minPopulation));
    }
}
