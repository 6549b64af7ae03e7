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

package com.dedicatedcode.crimecity.service.classification;

import com.dedicatedcode.crimecity.model.Category;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CategoryClassifierTest {

    private final CategoryClassifier classifier =
            new CategoryClassifier(new ClassificationTableLoader().load("classpath:event_types.json"));

    @Test
    void testKnownTypes() {
        assertEquals(Category.TRAFFIC, classifier.classify("Trafikolycka, personskada"));
        assertEquals(Category.PROPERTY, classifier.classify("Inbrott"));
        assertEquals(Category.VIOLENCE, classifier.classify("Mord/dråp"));
        assertEquals(Category.NARCOTICS, classifier.classify("Narkotikabrott"));
        assertEquals(Category.FRAUD, classifier.classify("Bedrägeri"));
        assertEquals(Category.PUBLIC_ORDER, classifier.classify("Fylleri"));
        assertEquals(Category.WEAPONS, classifier.classify("Vapenlagen"));
    }

    @Test
    void testUnknownTypesFallBackToOther() {
        assertEquals(Category.OTHER, classifier.classify("Något helt nytt"));
        assertEquals(Category.OTHER, classifier.classify(""));
        assertEquals(Category.OTHER, classifier.classify(null));
    }

    @Test
    void testPendingTypesStayOther() {
        assertEquals(Category.OTHER, classifier.classify("Skottlossning"));
        assertTrue(classifier.isUnresolved("Skottlossning"));
        assertFalse(classifier.isUnresolved("Rattfylleri"));
    }

    @Test
    void testFingerprintParameters() {
        assertEquals("2024.2", classifier.fingerprintParameters().get("classification.version"));
        assertEquals(classifier.table().sha256(), classifier.fingerprintParameters().get("classification.sha256"));
    }
}
