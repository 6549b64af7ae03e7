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

import com.dedicatedcode.crimecity.exception.InputMissingException;
import com.dedicatedcode.crimecity.exception.SchemaMismatchException;
import com.dedicatedcode.crimecity.model.IncidentRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class IncidentReaderTest {

    @TempDir
    Path tempDir;

    private final IncidentReader reader = new IncidentReader();

    @Test
    void testReadIncidents() throws Exception {
        Path file = write("""
                id,datetime,name,summary,url,type,location_name,latitude,longitude
                1,2024-05-01 10:00:00,"01 maj 10.00, Stöld, Uppsala","Cykel stulen, centrum",/aktuellt/1, Stöld ,Uppsala,59.8586,17.6389

                2,2024-05-01 11:00:00,Okänd plats,,/aktuellt/2,Brand,Okänd,,abc
                """);

        List<IncidentRecord> incidents = read(file);

        assertEquals(2, incidents.size());
        IncidentRecord first = incidents.get(0);
        assertEquals("Stöld", first.type());
        assertEquals("Uppsala", first.locationName());
        assertEquals(59.8586, first.latitude(), 1e-9);
        assertEquals(17.6389, first.longitude(), 1e-9);
        assertEquals("01 maj 10.00, Stöld, Uppsala", first.name());
        assertEquals("Cykel stulen, centrum", first.summary());

        IncidentRecord second = incidents.get(1);
        assertTrue(Double.isNaN(second.latitude()));
        assertTrue(Double.isNaN(second.longitude()));
    }

    @Test
    void testOptionalColumnsMayBeAbsent() throws Exception {
        Path file = write("""
                datetime,type,location_name,latitude,longitude
                2024-05-01 10:00:00,Rån,Malmö,55.6050,13.0038
                """);

        IncidentRecord incident = read(file).get(0);

        assertEquals("", incident.id());
        assertEquals("", incident.url());
        assertEquals("Malmö", incident.locationName());
    }

    @Test
    void testByteOrderMarkIsIgnored() throws Exception {
        Path file = write("\uFEFFdatetime,type,location_name,latitude,longitude\n2024-05-01,Rån,Malmö,55.6,13.0\n");

        assertEquals(1, read(file).size());
    }

    @Test
    void testMissingColumnIsNamed() throws Exception {
        Path file = write("""
                datetime,type,location_name,latitude
                2024-05-01 10:00:00,Rån,Malmö,55.6050
                """);

        SchemaMismatchException e = assertThrows(SchemaMismatchException.class, () -> reader.stream(file));
        assertEquals("longitude", e.getField());
    }

    @Test
    void testMalformedRowFailsWhenConsumed() throws Exception {
        Path file = write("""
                datetime,type,location_name,latitude,longitude
                2024-05-01 10:00:00,"Rån,Malmö,55.6050,13.0038
                """);

        try (Stream<IncidentRecord> incidents = reader.stream(file)) {
            assertThrows(UncheckedIOException.class, () -> incidents.forEach(incident -> {
            }));
        }
    }

    @Test
    void testMissingFile() {
        assertThrows(InputMissingException.class, () -> reader.stream(tempDir.resolve("events.csv")));
    }

    @Test
    void testParseCoordinate() {
        assertEquals(18.0586, IncidentReader.parseCoordinate(" 18.0586 "), 1e-9);
        assertTrue(Double.isNaN(IncidentReader.parseCoordinate("")));
        assertTrue(Double.isNaN(IncidentReader.parseCoordinate(null)));
        assertTrue(Double.isNaN(IncidentReader.parseCoordinate("59,33")));
    }

    private List<IncidentRecord> read(Path file) throws Exception {
        try (Stream<IncidentRecord> incidents = reader.stream(file)) {
            return incidents.collect(Collectors.toList());
        }
    }

    private Path write(String content) throws Exception {
        Path file = tempDir.resolve("events.csv");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
