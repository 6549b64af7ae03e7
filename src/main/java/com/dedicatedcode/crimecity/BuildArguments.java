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

package com.dedicatedcode.crimecity;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Command line of the build mode:
 * {@code --build [--resolutions 4,5,6] [--data-dir DIR] [--force] [--skip-municipalities]}.
 */
record BuildArguments(boolean build, List<Integer> resolutions, String dataDir, boolean force, boolean skipMunicipalities) {

    static BuildArguments parse(String... args) {
        boolean build = false;
        List<Integer> resolutions = null;
        String dataDir = null;
        boolean force = false;
        boolean skipMunicipalities = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--build".equals(arg)) {
                build = true;
            } else if ("--force".equals(arg)) {
                force = true;
            } else if ("--skip-municipalities".equals(arg)) {
                skipMunicipalities = true;
            } else if ("--resolutions".equals(arg)) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--resolutions requires a value, e.g. --resolutions 4,5,6");
                }
                resolutions = parseResolutions(args[++i]);
            } else if (arg.startsWith("--resolutions=")) {
                resolutions = parseResolutions(arg.substring("--resolutions=".length()));
            } else if ("--data-dir".equals(arg)) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--data-dir requires a value");
                }
                dataDir = args[++i];
            } else if (arg.startsWith("--data-dir=")) {
                dataDir = arg.substring("--data-dir=".length());
            }
        }
        return new BuildArguments(build, resolutions, dataDir, force, skipMunicipalities);
    }

    static List<Integer> parseResolutions(String value) {
        Set<Integer> resolutions = new LinkedHashSet<>();
        for (String part : value.split(",")) {
            if (part.isBlank()) {
                continue;
            }
            try {
                resolutions.add(Integer.parseInt(part.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid resolution '" + part.trim() + "' in " + value);
            }
        }
        if (resolutions.isEmpty()) {
            throw new IllegalArgumentException("No resolution given in '" + value + "'");
        }
        return List.copyOf(resolutions);
    }
}
