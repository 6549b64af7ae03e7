package com.dedicatedcode.crimecity.service.aggregation;

import com.dedicatedcode.crimecity.config.CrimeCityConfiguration;
import com.dedicatedcode.crimecity.exception.PipelineException;
import com.dedicatedcode.crimecity.model.AggregationSummary;
import com.dedicatedcode.crimecity.model.IncidentRecord;
import com.dedicatedcode.crimecity.model.UnitCounts;
import com.dedicatedcode.crimecity.service.classification.CategoryClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Groups incidents by spatial key and raw type and rolls the groups up into the eight categories.
 * <p>
 * The input is read in chunks of {@code chunkSize} records, each chunk counted on its own worker.
 * Every qualifying record ends up either in a unit or in the unmapped counter; the run fails if the
 * two do not add up to the qualifying records.
 */
public class Aggregator {

    private static final Logger logger = LoggerFactory.getLogger(Aggregator.class);

    private final CategoryClassifier classifier;
    private final int threads;
    private final int chunkSize;

    public Aggregator(CategoryClassifier classifier, CrimeCityConfiguration.AggregationConfiguration config) {
        this(classifier, config.getThreads(), config.getChunkSize());
    }

    public Aggregator(CategoryClassifier classifier, int threads, int chunkSize) {
        this.classifier = classifier;
        this.threads = Math.max(1, threads);
        this.chunkSize = Math.max(1, chunkSize);
    }

    public AggregationResult aggregate(Stream<IncidentRecord> incidents, IncidentFilter filter, SpatialKeyResolver resolver) {
        UnitAccumulator total = threads == 1
                ? aggregateInline(incidents.iterator(), filter, resolver)
                : aggregateParallel(incidents.iterator(), filter, resolver);

        List<UnitCounts> units = total.finish(classifier);
        AggregationSummary summary = new AggregationSummary(total.input, total.excluded, total.unmapped, total.aggregated, units.size(), 0);
        if (!summary.isConserved()) {
            throw new PipelineException(String.format(
                    "Aggregation lost records: qualifying=%d aggregated=%d unmapped=%d",
                    summary.qualifyingRecords(), summary.aggregatedRecords(), summary.unmappedRecords()));
        }
        if (summary.unmappedRecords() > 0) {
            logger.warn("{} of {} qualifying records could not be assigned to a spatial unit",
                    summary.unmappedRecords(), summary.qualifyingRecords());
        }
        logger.info("Aggregated {} records into {} units ({} excluded)",
                summary.aggregatedRecords(), units.size(), summary.excludedRecords());
        return new AggregationResult(units, summary);
    }

    private UnitAccumulator aggregateInline(Iterator<IncidentRecord> incidents, IncidentFilter filter, SpatialKeyResolver resolver) {
        UnitAccumulator accumulator = new UnitAccumulator();
        while (incidents.hasNext()) {
            count(incidents.next(), filter, resolver, accumulator);
        }
        return accumulator;
    }

    private UnitAccumulator aggregateParallel(Iterator<IncidentRecord> incidents, IncidentFilter filter, SpatialKeyResolver resolver) {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        ExecutorCompletionService<UnitAccumulator> ecs = new ExecutorCompletionService<>(executor);
        Semaphore inFlight = new Semaphore(threads * 2);
        UnitAccumulator total = new UnitAccumulator();
        int submitted = 0;
        int collected = 0;
        try {
            while (incidents.hasNext()) {
                List<IncidentRecord> chunk = new ArrayList<>(Math.min(chunkSize, 4096));
                while (incidents.hasNext() && chunk.size() < chunkSize) {
                    chunk.add(incidents.next());
                }
                inFlight.acquire();
                ecs.submit(() -> {
                    try {
                        UnitAccumulator partial = new UnitAccumulator();
                        for (IncidentRecord record : chunk) {
                            count(record, filter, resolver, partial);
                        }
                        return partial;
                    } finally {
                        inFlight.release();
                    }
                });
                submitted++;

                for (Future<UnitAccumulator> f; (f = ecs.poll()) != null; ) {
                    total.merge(f.get());
                    collected++;
                }
            }
            while (collected < submitted) {
                total.merge(ecs.take().get());
                collected++;
            }
            return total;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("Aggregation interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new PipelineException("Aggregation worker failed", e.getCause());
        } finally {
            executor.shutdownNow();
            try {
                executor.awaitTermination(1, TimeUnit.MINUTES);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static void count(IncidentRecord record, IncidentFilter filter, SpatialKeyResolver resolver, UnitAccumulator accumulator) {
        accumulator.input++;
        if (filter.isExcluded(record)) {
            accumulator.excluded++;
            return;
        }
        Optional<String> key = resolver.keyFor(record);
        if (key.isEmpty()) {
            accumulator.unmapped++;
            return;
        }
        accumulator.add(key.get(), record.type(), record.locationName());
    }
}
