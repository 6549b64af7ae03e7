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
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A CSV file with a header row, read one row at a time.
 */
final class CsvInput implements Closeable {

    private final Path path;
    private final CSVReader reader;
    private final Map<String, Integer> columns;

    private CsvInput(Path path, CSVReader reader, Map<String, Integer> columns) {
        this.path = path;
        this.reader = reader;
        this.columns = columns;
    }

    /**
     * Opens the file and checks the header carries every required column.
     *
     * @throws InputMissingException   if the file does not exist
     * @throws SchemaMismatchException naming the first required column not present
     */
    static CsvInput open(Path path, Collection<String> requiredColumns) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new InputMissingException(path);
        }
        CSVReader reader = new CSVReaderBuilder(Files.newBufferedReader(path, StandardCharsets.UTF_8))
                .withCSVParser(new RFC4180ParserBuilder().build())
                .build();
        try {
            String[] header = reader.readNext();
            if (header == null) {
                throw new SchemaMismatchException(path.toString(), requiredColumns.isEmpty() ? "header" : requiredColumns.iterator().next());
            }
            Map<String, Integer> columns = new HashMap<>();
            for (int i = 0; i < header.length; i++) {
                columns.put(stripBom(header[i]).trim(), i);
            }
            for (String required : requiredColumns) {
                if (!columns.containsKey(required)) {
                    throw new SchemaMismatchException(path.toString(), required);
                }
            }
            return new CsvInput(path, reader, columns);
        } catch (CsvValidationException e) {
            reader.close();
            throw new SchemaMismatchException(path.toString(), "header", e.getMessage());
        } catch (RuntimeException | IOException e) {
            reader.close();
            throw e;
        }
    }

    /**
     * Value of a column in the row, empty when the row is shorter than the header or the column is absent.
     */
    String get(String[] row, String column) {
        Integer index = columns.get(column);
        if (index == null || index >= row.length || row[index] == null) {
            return "";
        }
        return row[index];
    }

    String[] next() throws IOException {
        try {
            String[] row;
            do {
                row = reader.readNext();
            } while (row != null && isBlank(row));
            return row;
        } catch (CsvValidationException e) {
            throw new IOException("Malformed CSV in " + path + " at line " + reader.getLinesRead(), e);
        }
    }

    /**
     * Lazily maps the remaining rows. Nothing is read before the stream is consumed;
     * closing the stream closes the file.
     */
    <T> Stream<T> stream(RowMapper<T> mapper) {
        Iterator<T> iterator = new Iterator<>() {
            private String[] nextRow;
            private boolean done;

            @Override
            public boolean hasNext() {
                if (nextRow == null && !done) {
                    try {
                        nextRow = CsvInput.this.next();
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                    done = nextRow == null;
                }
                return nextRow != null;
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                String[] row = nextRow;
                nextRow = null;
                return mapper.map(CsvInput.this, row);
            }
        };
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(() -> {
                    try {
                        close();
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                });
    }

    Path path() {
        return path;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    private static boolean isBlank(String[] row) {
        return row.length == 0 || (row.length == 1 && (row[0] == null || row[0].isBlank()));
    }

    private static String stripBom(String value) {
        return value != null && value.startsWith("\uFEFF") ? value.substring(1) : value;
    }

    @FunctionalInterface
    interface RowMapper<T> {
        T map(CsvInput input, String[] row);
    }
}
