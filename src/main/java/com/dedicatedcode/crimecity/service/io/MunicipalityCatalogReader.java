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

package com.dedicatedcode.crimecity.service.io;

import com.dedicatedcode.crimecity.exception.SchemaMismatchException;
import com.dedicatedcode.crimecity.model.AdministrativeUnit;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Reads the fixed municipality catalog: {@code code,name,population}.
 */
@Component
public class MunicipalityCatalogReader {

    public static final List<String> REQUIRED_COLUMNS = List.of("code", "name", "population");

    public List<AdministrativeUnit> read(Path catalogFile) throws IOException {
        List<AdministrativeUnit> units = new ArrayList<>();
        Set<String> codes = new HashSet<>();
        CsvInput input = CsvInput.open(catalogFile, REQUIRED_COLUMNS);
        try (Stream<AdministrativeUnit> rows = input.stream(MunicipalityCatalogReader::toUnit)) {
            rows.forEach(unit -> {
                if (!codes.add(unit.code())) {
                    throw new SchemaMismatchException(catalogFile.toString(), "code", "duplicate code " + unit.code());
                }
                units.add(unit);
            });
        }
        return units;
    }

    private static AdministrativeUnit toUnit(CsvInput input, String[] row) {
        String code = input.get(row, "code").trim();
        if (code.isEmpty()) {
            throw new SchemaMismatchException(input.path().toString(), "code", "empty code");
        }
        String population = input.get(row, "population").trim();
        try {
            return new AdministrativeUnit(code, input.get(row, "name").trim(),
                    population.isEmpty() ? 0 : Long.parseLong(population));
        } catch (NumberFormatException e) {
            throw new SchemaMismatchException(input.path().toString(), "population", "not a number: " + population);
        }
    }
}
