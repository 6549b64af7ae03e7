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
import com.dedicatedcode.crimecity.model.PopulationCount;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MunicipalityCatalogReaderTest {

    @TempDir
    Path tempDir;

    private final MunicipalityCatalogReader reader = new MunicipalityCatalogReader();

    @Test
    void testReadCatalog() throws Exception {
        Path file = tempDir.resolve("municipality_population.csv");
        Files.writeString(file, "code,name,population\n0180,Stockholm,984748\n2418,Malå,3040\n");

        List<AdministrativeUnit> units = reader.read(file);

        assertEquals(List.of(new AdministrativeUnit("0180", "Stockholm", 984748),
                new AdministrativeUnit("2418", "Malå", 3040)), units);
    }

    @Test
    void testDuplicateCodeIsRejected() throws Exception {
        Path file = tempDir.resolve("municipality_population.csv");
        Files.writeString(file, "code,name,population\n0180,Stockholm,1\n0180,Solna,2\n");

        SchemaMismatchException e = assertThrows(SchemaMismatchException.class, () -> reader.read(file));
        assertEquals("code", e.getField());
    }

    @Test
    void testInvalidPopulation() throws Exception {
        Path file = tempDir.resolve("municipality_population.csv");
        Files.writeString(file, "code,name,population\n0180,Stockholm,many\n");

        SchemaMismatchException e = assertThrows(SchemaMismatchException.class, () -> reader.read(file));
        assertEquals("population", e.getField());
    }

    @Test
    void testPopulationTableRoundTrip() throws Exception {
        PopulationTableIO tableIO = new PopulationTableIO();
        Path file = tempDir.resolve("grid").resolve("population_r4.csv");

        tableIO.write(List.of(new PopulationCount("841f2b5ffffffff", 1500, 760, 740),
                new PopulationCount("841f05bffffffff", 20, 10, 10)), file);
        Map<String, PopulationCount> read = tableIO.read(file);

        assertEquals(List.of("841f2b5ffffffff", "841f05bffffffff"), List.copyOf(read.keySet()));
        assertEquals(1500, read.get("841f2b5ffffffff").population());
        assertEquals("cell,population,female,male", Files.readAllLines(file).get(0));
    }
}
