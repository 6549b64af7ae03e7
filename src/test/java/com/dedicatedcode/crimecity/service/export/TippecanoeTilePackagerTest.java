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

import com.dedicatedcode.crimecity.exception.TilePackagingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TippecanoeTilePackagerTest {

    @TempDir
    Path tempDir;

    @Test
    void testCellCommand() {
        TippecanoeTilePackager packager = new TippecanoeTilePackager("tippecanoe");
        TilingOptions options = TilingOptions.forResolution(FeatureSchema.cells("h3"), 5, 10);
        Path features = Path.of("data/tiles/geojsonl/h3_r5.geojsonl.gz");
        Path output = Path.of("data/tiles/pmtiles/h3_r5.pmtiles");

        List<String> command = packager.buildCommand(features, output, options);

        assertEquals(List.of("tippecanoe", "-o", output.toString(), "--layer=h3_cells",
                "--minimum-zoom=5", "--maximum-zoom=9", "--simplification=10", "--force",
                "--maximum-tile-features=10000", "--drop-densest-as-needed", "--extend-zooms-if-still-dropping", "-P"),
                command.subList(0, 12));
        assertTrue(command.contains("--include=h3_cell"));
        assertTrue(command.contains("--include=rate_per_10000"));
        assertEquals(features.toString(), command.get(command.size() - 1));
    }

    @Test
    void testMunicipalityCommandKeepsEveryFeature() {
        TippecanoeTilePackager packager = new TippecanoeTilePackager("/opt/tippecanoe/bin/tippecanoe");
        TilingOptions options = TilingOptions.forMunicipalities(FeatureSchema.municipalities(), 10);

        List<String> command = packager.buildCommand(Path.of("municipalities.geojson"), Path.of("municipalities.pmtiles"), options);

        assertEquals("/opt/tippecanoe/bin/tippecanoe", command.get(0));
        assertTrue(command.contains("--minimum-zoom=3"));
        assertTrue(command.contains("--maximum-zoom=10"));
        assertTrue(command.contains("--no-feature-limit"));
        assertTrue(command.contains("--no-tile-size-limit"));
        assertFalse(command.contains("--drop-densest-as-needed"));
        assertFalse(command.contains("-P"));
        assertTrue(command.contains("--include=kommun_namn"));
    }

    @Test
    void testMissingBinary() throws Exception {
        Path features = Files.writeString(tempDir.resolve("h3_r4.geojsonl"), "");
        TippecanoeTilePackager packager = new TippecanoeTilePackager(tempDir.resolve("no-such-tippecanoe").toString());

        assertThrows(TilePackagingException.class, () -> packager.pack(features, tempDir.resolve("h3_r4.pmtiles"),
                TilingOptions.forResolution(FeatureSchema.cells("h3"), 4, 10)));
        assertFalse(Files.exists(tempDir.resolve("h3_r4.pmtiles")));
    }

    @Test
    void testMissingFeatureFile() {
        TippecanoeTilePackager packager = new TippecanoeTilePackager("tippecanoe");

        assertThrows(TilePackagingException.class, () -> packager.pack(tempDir.resolve("missing.geojsonl"),
                tempDir.resolve("out.pmtiles"), TilingOptions.forResolution(FeatureSchema.cells("h3"), 4, 10)));
    }

    @Test
    void testZoomRanges() {
        FeatureSchema schema = FeatureSchema.cells("h3");

        assertEquals(4, TilingOptions.forResolution(schema, 4, 10).minZoom());
        assertEquals(8, TilingOptions.forResolution(schema, 4, 10).maxZoom());
        assertEquals(10, TilingOptions.forResolution(schema, 6, 10).maxZoom());
        assertEquals(8, TilingOptions.forResolution(schema, 6, 8).maxZoom());
        assertEquals(8, TilingOptions.forMunicipalities(FeatureSchema.municipalities(), 8).maxZoom());
        assertThrows(IllegalArgumentException.class, () -> new TilingOptions("x", 5, 4, List.of(), true));
    }
}
