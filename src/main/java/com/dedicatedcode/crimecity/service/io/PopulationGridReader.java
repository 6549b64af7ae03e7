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
import com.dedicatedcode.crimecity.model.PopulationGridCell;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads the population grid: {@code geometry,population,female,male}, geometry as WKT
 * in the projected reference system of the source.
 */
@Component
public class PopulationGridReader {

    public static final List<String> REQUIRED_COLUMNS = List.of("geometry", "population", "female", "male");

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    public Stream<PopulationGridCell> stream(Path gridFile) throws IOException {
        CsvInput input = CsvInput.open(gridFile, REQUIRED_COLUMNS);
        WKTReader wktReader = new WKTReader(GEOMETRY_FACTORY);
        return input.stream((in, row) -> new PopulationGridCell(
                parseGeometry(wktReader, in.get(row, "geometry"), in),
                parseCount(in, row, "population"),
                parseCount(in, row, "female"),
                parseCount(in, row, "male")));
    }

    private static Geometry parseGeometry(WKTReader reader, String wkt, CsvInput input) {
        try {
            return reader.read(wkt);
        } catch (ParseException e) {
            throw new SchemaMismatchException(input.path().toString(), "geometry", e.getMessage());
        }
    }

    /**
     * Counts may be published as decimals by the statistics office.
     */
    private static long parseCount(CsvInput input, String[] row, String column) {
        String value = input.get(row, column).trim();
        if (value.isEmpty()) {
            return 0;
        }
        try {
            return Math.round(Double.parseDouble(value));
        } catch (NumberFormatException e) {
            throw new SchemaMismatchException(input.path().toString(), column, "not a number: " + value);
        }
    }
}
