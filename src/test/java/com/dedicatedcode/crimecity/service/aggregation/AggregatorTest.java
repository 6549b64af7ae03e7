package com.dedicatedcode.crimecity.service.aggregation;

import com.dedicatedcode.crimecity.exception.SchemaMismatchException;
import com.dedicatedcode.crimecity.model.AdministrativeUnit;
import com.dedicatedcode.crimecity.model.AggregationSummary;
import com.dedicatedcode.crimecity.model.Category;
import com.dedicatedcode.crimecity.model.IncidentRecord;
import com.dedicatedcode.crimecity.model.SubtypeCount;
import com.dedicatedcode.crimecity.model.UnitCounts;
import com.dedicatedcode.crimecity.service.classification.CategoryClassifier;
import com.dedicatedcode.crimecity.service.classification.ClassificationTable;
import com.dedicatedcode.crimecity.service.spatial.H3SpatialIndexer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AggregatorTest {

    private static final double STOCKHOLM_LAT = 59.3303;
    private static final double STOCKHOLM_LON = 18.0586;
    private static final double GOTHENBURG_LAT = 57.7089;
    private static final double GOTHENBURG_LON = 11.9746;

    private final CategoryClassifier classifier = new CategoryClassifier(new ClassificationTable("test", "0",
            Map.of("Stöld", Category.PROPERTY,
                   "Misshandel", Category.VIOLENCE,
                   "Rattfylleri", Category.TRAFFIC),
            Set.of()));
    private final H3SpatialIndexer indexer = new H3SpatialIndexer();
    private final IncidentFilter filter = new IncidentFilter(List.of("Sammanfattning.*"), List.of());

    @Test
    void rollsSubtypesUpIntoCategories() {
        List<IncidentRecord> incidents = List.of(
                incident("Stöld", "Stockholm", STOCKHOLM_LAT, STOCKHOLM_LON),
                incident("Stöld", "Stockholm", STOCKHOLM_LAT, STOCKHOLM_LON),
                incident("Stöld", "Stockholm", STOCKHOLM_LAT, STOCKHOLM_LON),
                incident("Misshandel", "Stockholm", STOCKHOLM_LAT, STOCKHOLM_LON),
                incident("Misshandel", "Stockholm", STOCKHOLM_LAT, STOCKHOLM_LON));

        AggregationResult result = new Aggregator(classifier, 1, 100)
                .aggregate(incidents.stream(), filter, new CellKeyResolver(indexer, 5));

        assertThat(result.units()).hasSize(1);
        UnitCounts unit = result.units().get(0);
        assertThat(unit.categories().get(Category.PROPERTY)).isEqualTo(3);
        assertThat(unit.categories().get(Category.VIOLENCE)).isEqualTo(2);
        assertThat(unit.total()).isEqualTo(5);
        assertThat(unit.subtypes()).containsExactly(new SubtypeCount("Stöld", 3), new SubtypeCount("Misshandel", 2));
        assertThat(unit.dominantLocation()).isEqualTo("Stockholm");
    }

    @Test
    void unmatchedTypesAreCountedAsOther() {
        AggregationResult result = new Aggregator(classifier, 1, 100).aggregate(
                List.of(incident("Brand i skog", "Umeå", 63.8258, 20.2630)).stream(),
                filter, new CellKeyResolver(indexer, 4));

        UnitCounts unit = result.units().get(0);
        assertThat(unit.categories().get(Category.OTHER)).isEqualTo(1);
        assertThat(unit.categories().total()).isEqualTo(1);
    }

    @Test
    void outOfRangeCoordinateIsUnmappedExactlyOnce() {
        List<IncidentRecord> incidents = List.of(
                incident("Stöld", "Stockholm", STOCKHOLM_LAT, STOCKHOLM_LON),
                incident("Stöld", "Okänd", 123.0, 18.0),
                incident("Stöld", "Okänd", Double.NaN, Double.NaN));

        AggregationResult result = new Aggregator(classifier, 1, 100)
                .aggregate(incidents.stream(), filter, new CellKeyResolver(indexer, 5));

        AggregationSummary summary = result.summary();
        assertThat(summary.inputRecords()).isEqualTo(3);
        assertThat(summary.unmappedRecords()).isEqualTo(2);
        assertThat(summary.aggregatedRecords()).isEqualTo(1);
        assertThat(result.units().stream().mapToLong(UnitCounts::total).sum()).isEqualTo(1);
        assertThat(summary.isConserved()).isTrue();
    }

    @Test
    void excludedRecordsContributeNothing() {
        List<IncidentRecord> incidents = List.of(
                incident("Sammanfattning natt", "Stockholm", STOCKHOLM_LAT, STOCKHOLM_LON),
                incident("Sammanfattning kväll", "Okänd", 123.0, 18.0),
                incident("Stöld", "Stockholm", STOCKHOLM_LAT, STOCKHOLM_LON));

        AggregationResult result = new Aggregator(classifier, 1, 100)
                .aggregate(incidents.stream(), filter, new CellKeyResolver(indexer, 5));

        assertThat(result.summary().excludedRecords()).isEqualTo(2);
        assertThat(result.summary().unmappedRecords()).isZero();
        assertThat(result.summary().qualifyingRecords()).isEqualTo(1);
        assertThat(result.units()).hasSize(1);
        assertThat(result.units().get(0).total()).isEqualTo(1);
    }

    @Test
    void totalsMatchQualifyingRecordsAtEveryResolution() {
        List<IncidentRecord> incidents = randomIncidents(2_000, 7L);
        for (int resolution : List.of(4, 5, 6)) {
            AggregationResult result = new Aggregator(classifier, 1, 100)
                    .aggregate(incidents.stream(), filter, new CellKeyResolver(indexer, resolution));

            long total = result.units().stream().mapToLong(UnitCounts::total).sum();
            assertThat(total + result.summary().unmappedRecords()).isEqualTo(result.summary().qualifyingRecords());
        }
    }

    @Test
    void chunkingAndOrderDoNotChangeTheResult() {
        List<IncidentRecord> incidents = randomIncidents(5_000, 42L);
        AggregationResult sequential = new Aggregator(classifier, 1, 10_000)
                .aggregate(incidents.stream(), filter, new CellKeyResolver(indexer, 5));

        List<IncidentRecord> shuffled = new ArrayList<>(incidents);
        Collections.shuffle(shuffled, new Random(1));
        AggregationResult parallel = new Aggregator(classifier, 4, 137)
                .aggregate(shuffled.stream(), filter, new CellKeyResolver(indexer, 5));

        assertThat(parallel.units()).isEqualTo(sequential.units());
        assertThat(parallel.summary()).isEqualTo(sequential.summary());
    }

    @Test
    void dominantLocationTiesAreBrokenByName() {
        List<IncidentRecord> incidents = List.of(
                incident("Stöld", "Solna", STOCKHOLM_LAT, STOCKHOLM_LON),
                incident("Stöld", "Stockholm", STOCKHOLM_LAT, STOCKHOLM_LON));

        AggregationResult result = new Aggregator(classifier, 1, 100)
                .aggregate(incidents.stream(), filter, new CellKeyResolver(indexer, 4));

        assertThat(result.units().get(0).dominantLocation()).isEqualTo("Solna");
    }

    @Test
    void catalogPathMatchesNamesIgnoringCase() {
        List<AdministrativeUnit> catalog = List.of(
                new AdministrativeUnit("0180", "Stockholm", 984_748),
                new AdministrativeUnit("1480", "Göteborg", 604_616));
        IncidentFilter catalogFilter = new IncidentFilter(List.of("Sammanfattning.*"), List.of(".* län"));
        List<IncidentRecord> incidents = List.of(
                incident("Stöld", "STOCKHOLM", STOCKHOLM_LAT, STOCKHOLM_LON),
                incident("Rattfylleri", "göteborg", GOTHENBURG_LAT, GOTHENBURG_LON),
                incident("Stöld", "Stockholms län", STOCKHOLM_LAT, STOCKHOLM_LON),
                incident("Stöld", "Atlantis", 0.0, 0.0));

        AggregationResult result = new Aggregator(classifier, 1, 100)
                .aggregate(incidents.stream(), catalogFilter, new CatalogKeyResolver(catalog));

        assertThat(result.units()).extracting(UnitCounts::key).containsExactly("0180", "1480");
        assertThat(result.summary().excludedRecords()).isEqualTo(1);
        assertThat(result.summary().unmappedRecords()).isEqualTo(1);
    }

    @Test
    void workerFailureIsPropagated() {
        SpatialKeyResolver failing = record -> {
            throw new IllegalStateException("resolver broke");
        };

        assertThatThrownBy(() -> new Aggregator(classifier, 2, 10)
                .aggregate(randomIncidents(100, 3L).stream(), filter, failing))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("resolver broke");
    }

    @Test
    void resolverReturningEmptyCountsAsUnmapped() {
        SpatialKeyResolver nowhere = record -> Optional.empty();

        AggregationResult result = new Aggregator(classifier, 2, 10)
                .aggregate(randomIncidents(95, 5L).stream(), filter, nowhere);

        AggregationSummary summary = result.summary();
        assertThat(result.units()).isEmpty();
        assertThat(summary.excludedRecords()).isPositive();
        assertThat(summary.unmappedRecords()).isEqualTo(summary.qualifyingRecords());
        assertThat(summary.excludedRecords() + summary.unmappedRecords()).isEqualTo(95);
    }

    @Test
    void catalogNamesMustBeUniqueIgnoringCase() {
        List<AdministrativeUnit> catalog = List.of(
                new AdministrativeUnit("0180", "Stockholm", 984_748),
                new AdministrativeUnit("0181", " STOCKHOLM ", 1_000));

        assertThatThrownBy(() -> new CatalogKeyResolver(catalog))
                .isInstanceOf(SchemaMismatchException.class)
                .hasMessageContaining("0180")
                .hasMessageContaining("0181");
    }

    private static List<IncidentRecord> randomIncidents(int count, long seed) {
        Random random = new Random(seed);
        String[] types = {"Stöld", "Misshandel", "Rattfylleri", "Okänt", "Sammanfattning dag"};
        String[] places = {"Stockholm", "Uppsala", "Malmö", "Luleå"};
        List<IncidentRecord> incidents = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double lat = random.nextInt(50) == 0 ? 200.0 : 55.0 + random.nextDouble() * 14.0;
            double lon = 11.0 + random.nextDouble() * 13.0;
            incidents.add(new IncidentRecord(Integer.toString(i), "2024-01-01 12:00:00",
                    types[random.nextInt(types.length)], places[random.nextInt(places.length)],
                    lat, lon, null, null, null));
        }
        return incidents;
    }

    static IncidentRecord incident(String type, String location, double lat, double lon) {
        return new IncidentRecord("1", "2024-05-01 10:00:00", type, location, lat, lon, null, null, null);
    }
}
