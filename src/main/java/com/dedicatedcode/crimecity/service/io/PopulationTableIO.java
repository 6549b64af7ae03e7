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
import com.dedicatedcode.crimecity.model.PopulationCount;
import com.opencsv.ICSVWriter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * The per-resolution population table: {@code cell,population,female,male}.
 */
@Component
public class PopulationTableIO {

    public static final List<String> COLUMNS = List.of("cell", "population", "female", "male");

    public void write(Collection<PopulationCount> cells, Path target) throws IOException {
        try (ICSVWriter writer = CsvOutput.open(target)) {
            CsvOutput.writeRow(writer, COLUMNS.toArray(new String[0]));
            for (PopulationCount cell : cells) {
                CsvOutput.writeRow(writer, new String[]{
                        cell.cell(),
                        Long.toString(cell.population()),
                        Long.toString(cell.female()),
                        Long.toString(cell.male())
                });
            }
            CsvOutput.finish(writer);
        }
    }

    /**
     * Reads the table keyed by cell id, in file order.
     */
    public Map<String, PopulationCount> read(Path source) throws IOException {
        Map<String, PopulationCount> cells = new LinkedHashMap<>();
        CsvInput input = CsvInput.open(source, COLUMNS);
        try (Stream<PopulationCount> rows = input.stream((in, row) -> new PopulationCount(
                in.get(row, "cell"),
                parseLong(in, row, "population"),
                parseLong(in, row, "female"),
                parseLong(in, row, "male")))) {
            rows.forEach(cell -> cells.put(cell.cell(), cell));
        }
        return cells;
    }

    private static long parseLong(CsvInput input, String[] row, String column) {
        String value = input.get(row, column).trim();
        try {
            return value.isEmpty() ? 0 : Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new SchemaMismatchException(input.path().toString(), column, "not a number: " + value);
        }
    }
}
