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

import com.dedicatedcode.crimecity.exception.SchemaMismatchException;
import com.dedicatedcode.crimecity.model.AdministrativeUnit;
import com.dedicatedcode.crimecity.model.IncidentRecord;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Keys incidents by the catalog unit whose name equals the location name, ignoring case.
 * Names must be unique after trimming and lower-casing.
 */
public class CatalogKeyResolver implements SpatialKeyResolver {

    private final Map<String, String> codesByName;

    public CatalogKeyResolver(List<AdministrativeUnit> catalog) {
        Map<String, String> codes = new HashMap<>();
        for (AdministrativeUnit unit : catalog) {
            String previous = codes.putIfAbsent(normalize(unit.name()), unit.code());
            if (previous != null) {
                throw new SchemaMismatchException("municipality catalog", "name",
                        "units " + previous + " and " + unit.code() + " share the name '" + unit.name() + "'");
            }
        }
        this.codesByName = Map.copyOf(codes);
    }

    @Override
    public Optional<String> keyFor(IncidentRecord record) {
        if (record.locationName() == null || record.locationName().isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(codesByName.get(normalize(record.locationName())));
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
