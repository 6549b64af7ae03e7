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

package com.dedicatedcode.crimecity.service.pipeline;

import com.dedicatedcode.crimecity.service.export.TilePackager;
import com.dedicatedcode.crimecity.service.export.TilingOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;

/**
 * Feature file to a PMTiles archive through the external tiler.
 */
class TilePackagingStage implements BuildStage {

    private final String name;
    private final Path features;
    private final Path output;
    private final TilingOptions options;
    private final TilePackager packager;

    TilePackagingStage(String name, Path features, Path output, TilingOptions options, TilePackager packager) {
        this.name = name;
        this.features = features;
        this.output = output;
        this.options = options;
        this.packager = packager;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<Path> inputs() {
        return List.of(features);
    }

    @Override
    public Map<String, String> parameters() {
        return Map.of("tiles.layer", options.layer(),
                      "tiles.zoom", options.minZoom() + "-" + options.maxZoom(),
                      "tiles.attributes", String.join(",", options.attributes()),
                      "tiles.feature-limit", Boolean.toString(options.featureLimit()));
    }

    @Override
    public Path output() {
        return output;
    }

    /**
     * The tiler picks its output format from the file extension, so it writes under the final
     * file name in a scratch directory and the result is moved to {@code target}.
     */
    @Override
    public void build(Path target) throws IOException {
        Path scratch = Files.createTempDirectory(target.getParent(), ".tiles-");
        Path packed = scratch.resolve(output.getFileName());
        try {
            packager.pack(features, packed, options);
            Files.move(packed, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            AtomicFiles.deleteQuietly(packed);
            AtomicFiles.deleteQuietly(scratch);
        }
    }
}
