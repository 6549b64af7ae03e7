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

import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * RFC 4180 CSV writer with {@code \n} line ends, quoting only where a value needs it.
 */
final class CsvOutput {

    private CsvOutput() {
    }

    static ICSVWriter open(Path target) throws IOException {
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        return new CSVWriter(
                Files.newBufferedWriter(target, StandardCharsets.UTF_8),
                ICSVWriter.DEFAULT_SEPARATOR,
                ICSVWriter.DEFAULT_QUOTE_CHARACTER,
                ICSVWriter.DEFAULT_QUOTE_CHARACTER,
                ICSVWriter.DEFAULT_LINE_END);
    }

    static void writeRow(ICSVWriter writer, String[] row) {
        writer.writeNext(row, false);
    }

    /**
     * Flushes the writer and rethrows the first error it swallowed.
     */
    static void finish(ICSVWriter writer) throws IOException {
        if (writer.checkError()) {
            throw writer.getException() != null ? writer.getException() : new IOException("CSV write failed");
        }
    }
}
