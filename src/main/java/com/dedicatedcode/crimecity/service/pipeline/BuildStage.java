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

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * One step of a build target: a function of its declared inputs and parameters into one output file.
 */
public interface BuildStage {

    String name();

    /**
     * Files read by the stage. Their content is part of the fingerprint.
     */
    List<Path> inputs();

    /**
     * Configuration values the output depends on.
     */
    Map<String, String> parameters();

    Path output();

    /**
     * Writes the complete output to {@code target}, a temporary file that is published afterwards.
     */
    void build(Path target) throws IOException;

    /**
     * Called once the output is published, for sidecar files derived from the build.
     */
    default void afterPublish(Path output) throws IOException {
    }
}
