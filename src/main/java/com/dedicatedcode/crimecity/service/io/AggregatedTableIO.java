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
import com.dedicatedcode.crimecity.model.AggregatedUnit;
import com.dedicatedcode.crimecity.model.Category;
import com.dedicatedcode.crimecity.model.CategoryCounts;
import com.dedicatedcode.crimecity.model.SubtypeCount;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.ICSVWriter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads and writes aggregated tables.
 * <p>
 * Columns: key, name, dominant_location, total_count, the eight category columns, type_counts
 * (a JSON array of {@code {"type","count"}}), population, rate_per_10000, low_reliability.
 * Rows are written by total count descending and key ascending, so equal input gives equal bytes.
 */
@Component
public class AggregatedTableIO {

    public static final Comparator<AggregatedUnit> OUTPUT_ORDER = Comparator
            .comparingLong(AggregatedUnit::getTotalCount).reversed()
            .thenComparing(AggregatedUnit::getKey);

    public static final List<String> COLUMNS;

    static {
        List<String> columns = new ArrayList<>(List.of("key", "name", "dominant_location", "total_count"));
        for (Category category : Category.values()) {
            columns.add(category.columnName());
        }
        columns.addAll(List.of("type_counts", "population", "rate_per_10000", "low_reliability"));
        COLUMNS = List.copyOf(columns);
    }

    private static final TypeReference<List<SubtypeCount>> SUBTYPES = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public AggregatedTableIO() {
        this(new ObjectMapper());
    }

    @Autowired
    public AggregatedTableIO(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(Collection<AggregatedUnit> units, Path target) throws IOException {
        List<AggregatedUnit> sorted = units.stream().sorted(OUTPUT_ORDER).collect(Collectors.toList());
        try (ICSVWriter writer = CsvOutput.open(target)) {
            CsvOutput.writeRow(writer, COLUMNS.toArray(new String[0]));
            for (AggregatedUnit unit : sorted) {
                CsvOutput.writeRow(writer, toRow(unit));
            }
            CsvOutput.finish(writer);
        }
    }

    /**
     * Streams the rows of a table; the caller must close the stream.
     *
     * @throws SchemaMismatchException if a column is missing
     */
    public Stream<AggregatedUnit> stream(Path source) throws IOException {
        CsvInput input = CsvInput.open(source, COLUMNS);
        return input.stream(this::fromRow);
    }

    public List<AggregatedUnit> read(Path source) throws IOException {
        try (Stream<AggregatedUnit> rows = stream(source)) {
            return rows.collect(Collectors.toList());
        }
    }

    private String[] toRow(AggregatedUnit unit) throws JsonProcessingException {
        List<String> row = new ArrayList<>(COLUMNS.size());
        row.add(unit.getKey());
        row.add(nullToEmpty(unit.getName()));
        row.add(nullToEmpty(unit.getDominantLocation()));
        row.add(Long.toString(unit.getTotalCount()));
        for (Category category : Category.values()) {
            row.add(Long.toString(unit.getCategories().get(category)));
        }
        row.add(objectMapper.writeValueAsString(unit.getSubtypes()));
        row.add(Long.toString(unit.getPopulation()));
        row.add(Double.toString(unit.getRatePer10000()));
        row.add(Boolean.toString(unit.isLowReliability()));
        return row.toArray(new String[0]);
    }

    private AggregatedUnit fromRow(CsvInput input, String[] row) {
        Map<Category, Long> categories = new EnumMap<>(Category.class);
        for (Category category : Category.values()) {
            categories.put(category, parseLong(input, row, category.columnName()));
        }
        List<SubtypeCount> subtypes;
        try {
            String json = input.get(row, "type_counts");
            subtypes = json.isBlank() ? List.of() : objectMapper.readValue(json, SUBTYPES);
        } catch (JsonProcessingException e) {
            throw new SchemaMismatchException(input.path().toString(), "type_counts", e.getOriginalMessage());
        }
        String rate = input.get(row, "rate_per_10000").trim();
        try {
            return new AggregatedUnit(
                    input.get(row, "key"),
                    emptyToNull(input.get(row, "name")),
                    emptyToNull(input.get(row, "dominant_location")),
                    parseLong(input, row, "total_count"),
                    CategoryCounts.of(categories),
                    subtypes,
                    parseLong(input, row, "population"),
                    rate.isEmpty() ? 0.0 : Double.parseDouble(rate),
                    Boolean.parseBoolean(input.get(row, "low_reliability").trim()));
        } catch (NumberFormatException e) {
            throw new SchemaMismatchException(input.path().toString(), "rate_per_10000", "not a number: " + rate);
        } catch (IllegalStateException e) {
            throw new SchemaMismatchException(input.path().toString(), "total_count", e.getMessage());
        }
    }

    private static long parseLong(CsvInput input, String[] row, String column) {
        String value = input.get(row, column).trim();
        try {
            return value.isEmpty() ? 0 : Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new SchemaMismatchException(input.path().toString(), column, "not a number: " + value);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
