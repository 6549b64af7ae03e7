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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AggregatedUnitTest {

    @Test
    void testReconciledUnitIsAccepted() {
        CategoryCounts counts = CategoryCounts.of(Map.of(Category.PROPERTY, 3L, Category.OTHER, 1L));
        AggregatedUnit unit = new AggregatedUnit("851f1d4bfffffff", null, "Stockholm", 4, counts,
                List.of(new SubtypeCount("Stöld", 3), new SubtypeCount("Övrigt", 1)), 1000, 40.0, false);

        assertEquals(4, unit.getTotalCount());
        assertEquals(3, unit.getCategories().get(Category.PROPERTY));
        assertEquals(0, unit.getCategories().get(Category.VIOLENCE));
    }

    @Test
    void testTotalMustMatchCategories() {
        CategoryCounts counts = CategoryCounts.of(Map.of(Category.PROPERTY, 3L));

        assertThrows(IllegalStateException.class, () -> new AggregatedUnit("k", null, null, 4, counts,
                List.of(new SubtypeCount("Stöld", 3)), 0, 0.0, true));
    }

    @Test
    void testSubtypesMustMatchTotal() {
        CategoryCounts counts = CategoryCounts.of(Map.of(Category.PROPERTY, 3L));

        assertThrows(IllegalStateException.class, () -> new AggregatedUnit("k", null, null, 3, counts,
                List.of(new SubtypeCount("Stöld", 2)), 0, 0.0, true));
        assertThrows(IllegalStateException.class, () -> new UnitCounts("k", counts, List.of(new SubtypeCount("Stöld", 2)), null));
    }

    @Test
    void testNegativeCountsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> CategoryCounts.of(Map.of(Category.FRAUD, -1L)));
    }

    @Test
    void testSubtypeOrder() {
        List<SubtypeCount> subtypes = new ArrayList<>(List.of(
                new SubtypeCount("B", 2), new SubtypeCount("A", 2), new SubtypeCount("C", 5)));
        subtypes.sort(SubtypeCount.ORDER);

        assertEquals(List.of(new SubtypeCount("C", 5), new SubtypeCount("A", 2), new SubtypeCount("B", 2)), subtypes);
    }

    @Test
    void testCategoryColumnNames() {
        assertEquals("public_order_count", Category.PUBLIC_ORDER.columnName());
        assertEquals(Category.WEAPONS, Category.fromKey("weapons").orElseThrow());
        assertTrue(Category.fromKey("unknown").isEmpty());
    }
}
