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

package com.dedicatedcode.crimecity.service.export;

import com.dedicatedcode.crimecity.model.AggregatedUnit;
import com.dedicatedcode.crimecity.model.Category;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Property layout of the features of one layer.
 *
 * @param layer                   tile layer name
 * @param keyProperty             property carrying the unit key, e.g. {@code h3_cell} or {@code kommun_kod}
 * @param nameProperty            property carrying the unit name, null when units have none
 * @param includeDominantLocation whether the most frequent location name is emitted
 */
public record FeatureSchema(String layer, String keyProperty, String nameProperty, boolean includeDominantLocation) {

    public static final String DOMINANT_LOCATION = "dominant_location";

    public static FeatureSchema cells(String gridSystem) {
        return new FeatureSchema(gridSystem + "_cells", gridSystem + "_cell", null, true);
    }

    public static FeatureSchema municipalities() {
        return new FeatureSchema("municipalities", "kommun_kod", "kommun_namn", false);
    }

    public Map<String, Object> properties(AggregatedUnit unit) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(keyProperty, unit.getKey());
        if (nameProperty != null) {
            properties.put(nameProperty, unit.getName());
        }
        if (includeDominantLocation) {
            properties.put(DOMINANT_LOCATION, unit.getDominantLocation());
        }
        properties.put("total_count", unit.getTotalCount());
        for (Category category : Category.values()) {
            properties.put(category.columnName(), unit.getCategories().get(category));
        }
        properties.put("type_counts", unit.getSubtypes());
        properties.put("population", unit.getPopulation());
        properties.put("rate_per_10000", unit.getRatePer10000());
        properties.put("low_reliability", unit.isLowReliability());
        return properties;
    }

    /**
     * Names of all properties, in emission order. The tiler keeps exactly these.
     */
    public List<String> attributeNames() {
        List<String> names = new ArrayList<>();
        names.add(keyProperty);
        if (nameProperty != null) {
            names.add(nameProperty);
        }
        if (includeDominantLocation) {
            names.add(DOMINANT_LOCATION);
        }
        names.add("total_count");
        for (Category category : Category.values()) {
            names.add(category.columnName());
        }
        names.addAll(List.of("type_counts", "population", "rate_per_10000", "low_reliability"));
        return names;
    }
}
