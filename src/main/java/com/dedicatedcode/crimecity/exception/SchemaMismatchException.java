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

/**
 * An input lacks a field it is required to carry.
 */
public class SchemaMismatchException extends PipelineException {

    private final String field;

    public SchemaMismatchException(String source, String field) {
        super("Missing field '" + field + "' in " + source);
        this.field = field;
    }

    public SchemaMismatchException(String source, String field, String detail) {
        super("Invalid field '" + field + "' in " + source + ": " + detail);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
