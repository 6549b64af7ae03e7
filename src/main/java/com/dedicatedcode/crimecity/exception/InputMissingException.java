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

package com.dedicatedcode.crimecity.exception;

import java.nio.file.Path;

/**
 * A declared input of a stage does not exist. Raised before any output is touched.
 */
public class InputMissingException extends PipelineException {

    private final Path input;

    public InputMissingException(Path input) {
        super("Input not found: " + input);
        this.input = input;
    }

    public InputMissingException(String stage, Path input) {
        super("Stage '" + stage + "' is missing input: " + input);
        this.input = input;
    }

    public Path getInput() {
        return input;
    }
}
