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

import com.dedicatedcode.crimecity.model.IncidentRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads the incident source, one police event per row.
 * <p>
 * Columns: id, datetime, name, summary, url, type, location_name, latitude, longitude.
 * Coordinates that cannot be parsed are kept as NaN so the event shows up as unmapped.
 */
@Component
public class IncidentReader {

    public static final List<String> REQUIRED_COLUMNS = List.of("datetime", "type", "location_name", "latitude", "longitude");

    /**
     * Streams the incidents of the file; the caller must close the stream.
     */
    public Stream<IncidentRecord> stream(Path incidentsFile) throws IOException {
        CsvInput input = CsvInput.open(incidentsFile, REQUIRED_COLUMNS);
        return input.stream(IncidentReader::toRecord);
    }

    private static IncidentRecord toRecord(CsvInput input, String[] row) {
        return new IncidentRecord(
                input.get(row, "id"),
                input.get(row, "datetime"),
                input.get(row, "type").trim(),
                input.get(row, "location_name").trim(),
                parseCoordinate(input.get(row, "latitude")),
                parseCoordinate(input.get(row, "longitude")),
                input.get(row, "name"),
                input.get(row, "summary"),
                input.get(row, "url"));
    }

    static double parseCoordinate(String value) {
        if (value == null || value.isBlank()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
