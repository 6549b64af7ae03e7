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
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IncidentFilterTest {

    private final CrimeCityConfiguration.AggregationConfiguration config = new CrimeCityConfiguration.AggregationConfiguration();

    @Test
    void testSummariesAreExcludedOnBothPaths() {
        IncidentRecord summary = AggregatorTest.incident("Sammanfattning natt", "Uppsala", 59.86, 17.64);

        assertTrue(IncidentFilter.forCells(config).isExcluded(summary));
        assertTrue(IncidentFilter.forCatalog(config).isExcluded(summary));
    }

    @Test
    void testCountyReportsOnlyExcludedFromCatalog() {
        IncidentRecord county = AggregatorTest.incident("Stöld", "Uppsala län", 59.86, 17.64);

        assertFalse(IncidentFilter.forCells(config).isExcluded(county));
        assertTrue(IncidentFilter.forCatalog(config).isExcluded(county));
    }

    @Test
    void testPatternsMustMatchWholeValue() {
        IncidentFilter filter = IncidentFilter.forCatalog(config);

        assertFalse(filter.isExcluded(AggregatorTest.incident("Stöld, Sammanfattning", "Uppsala", 59.86, 17.64)));
        assertFalse(filter.isExcluded(AggregatorTest.incident("Stöld", "Länna", 59.86, 17.64)));
        assertFalse(filter.isExcluded(AggregatorTest.incident(null, null, 59.86, 17.64)));
    }

    @Test
    void testDescribe() {
        IncidentFilter filter = new IncidentFilter(List.of("A.*", "B"), List.of());

        assertEquals("types=[A.*,B];locations=[]", filter.describe());
    }
}
