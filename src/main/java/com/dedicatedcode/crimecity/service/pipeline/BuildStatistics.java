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

import com.dedicatedcode.crimecity.model.AggregationSummary;
import com.dedicatedcode.crimecity.service.export.ExportResult;
import com.dedicatedcode.crimecity.service.population.PopulationConversion;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of one build, shared by all targets, and the console summary printed at the end.
 */
public class BuildStatistics {
    private final AtomicLong stagesBuilt = new AtomicLong(0);
    private final AtomicLong stagesUpToDate = new AtomicLong(0);
    private final AtomicLong stagesFailed = new AtomicLong(0);
    private final AtomicLong stagesSkipped = new AtomicLong(0);
    private final AtomicLong recordsRead = new AtomicLong(0);
    private final AtomicLong recordsExcluded = new AtomicLong(0);
    private final AtomicLong recordsUnmapped = new AtomicLong(0);
    private final AtomicLong recordsAggregated = new AtomicLong(0);
    private final AtomicLong populationCells = new AtomicLong(0);
    private final AtomicLong populationRowsUnmapped = new AtomicLong(0);
    private final AtomicLong featuresExported = new AtomicLong(0);
    private final AtomicLong featuresWithoutBoundary = new AtomicLong(0);
    private final long startTime = System.currentTimeMillis();

    public void recordOutcome(StageOutcome outcome) {
        switch (outcome.status()) {
            case BUILT -> stagesBuilt.incrementAndGet();
            case UP_TO_DATE -> stagesUpToDate.incrementAndGet();
            case FAILED -> stagesFailed.incrementAndGet();
            case SKIPPED -> stagesSkipped.incrementAndGet();
        }
    }

    public void recordAggregation(AggregationSummary summary) {
        recordsRead.addAndGet(summary.inputRecords());
        recordsExcluded.addAndGet(summary.excludedRecords());
        recordsUnmapped.addAndGet(summary.unmappedRecords());
        recordsAggregated.addAndGet(summary.aggregatedRecords());
    }

    public void recordPopulation(PopulationConversion conversion) {
        populationCells.addAndGet(conversion.cells().size());
        populationRowsUnmapped.addAndGet(conversion.unmappableRows());
    }

    public void recordExport(ExportResult result) {
        featuresExported.addAndGet(result.exported());
        featuresWithoutBoundary.addAndGet(result.skippedWithoutBoundary());
    }

    public long getStagesBuilt() {
        return stagesBuilt.get();
    }

    public long getStagesUpToDate() {
        return stagesUpToDate.get();
    }

    public long getStagesFailed() {
        return stagesFailed.get();
    }

    public long getStagesSkipped() {
        return stagesSkipped.get();
    }

    public long getRecordsRead() {
        return recordsRead.get();
    }

    public long getRecordsExcluded() {
        return recordsExcluded.get();
    }

    public long getRecordsUnmapped() {
        return recordsUnmapped.get();
    }

    public long getRecordsAggregated() {
        return recordsAggregated.get();
    }

    public long getPopulationCells() {
        return populationCells.get();
    }

    public long getPopulationRowsUnmapped() {
        return populationRowsUnmapped.get();
    }

    public long getFeaturesExported() {
        return featuresExported.get();
    }

    public long getFeaturesWithoutBoundary() {
        return featuresWithoutBoundary.get();
    }

    public long getElapsedTime() {
        return System.currentTimeMillis() - startTime;
    }

    public void printFinalStatistics(BuildReport report) {
        System.out.println("\n\033[1;36m" + "═".repeat(80) + "\n" + centerText("BUILD STATISTICS") + "\n" + "═".repeat(80) + "\033[0m");

        System.out.printf("\n\033[1;37mTotal Build Time:\033[0m \033[1;33m%s\033[0m%n%n", formatTime(getElapsedTime()));

        System.out.println("\033[1;37mTargets:\033[0m");
        System.out.println("┌──────────────────────┬──────────────────────────┬──────────────┬────────────┐");
        System.out.println("│ \033[1mTarget\033[0m               │ \033[1mStage\033[0m                    │ \033[1mStatus\033[0m       │ \033[1mTime\033[0m       │");
        System.out.println("├──────────────────────┼──────────────────────────┼──────────────┼────────────┤");
        for (TargetReport target : report.targets()) {
            boolean first = true;
            for (StageOutcome stage : target.stages()) {
                System.out.printf("│ %-20s │ %-24s │ %s%-12s\033[0m │ %10s │%n",
                        first ? target.target() : "",
                        stage.stage(),
                        statusColor(stage.status()),
                        stage.status(),
                        formatTime(stage.durationMillis()));
                first = false;
            }
        }
        System.out.println("└──────────────────────┴──────────────────────────┴──────────────┴────────────┘");

        System.out.println("\n\033[1;37mRecords:\033[0m");
        System.out.println("┌─────────────────────┬─────────────────┐");
        System.out.printf("│ \033[32mRead\033[0m                │ %15s │%n", formatCompactNumber(getRecordsRead()));
        System.out.printf("│ \033[37mExcluded\033[0m            │ %15s │%n", formatCompactNumber(getRecordsExcluded()));
        System.out.printf("│ \033[33mUnmapped\033[0m            │ %15s │%n", formatCompactNumber(getRecordsUnmapped()));
        System.out.printf("│ \033[36mAggregated\033[0m          │ %15s │%n", formatCompactNumber(getRecordsAggregated()));
        System.out.printf("│ \033[35mPopulation cells\033[0m    │ %15s │%n", formatCompactNumber(getPopulationCells()));
        System.out.printf("│ \033[34mFeatures exported\033[0m   │ %15s │%n", formatCompactNumber(getFeaturesExported()));
        System.out.println("└─────────────────────┴─────────────────┘");

        System.out.printf("%n\033[1;37mStages:\033[0m \033[1;32m%d built\033[0m, %d up to date, \033[1;31m%d failed\033[0m, %d skipped%n",
                getStagesBuilt(), getStagesUpToDate(), getStagesFailed(), getStagesSkipped());
        System.out.println();
    }

    private String statusColor(StageStatus status) {
        return switch (status) {
            case BUILT -> "\033[32m";
            case UP_TO_DATE -> "\033[36m";
            case FAILED -> "\033[1;31m";
            case SKIPPED -> "\033[2m";
        };
    }

    private String formatTime(long ms) {
        long s = ms / 1000;
        return String.format("%d:%02d:%02d", s / 3600, (s % 3600) / 60, s % 60);
    }

    private String formatCompactNumber(long n) {
        if (n < 1000) return String.valueOf(n);
        if (n < 1_000_000) return String.format("%.2fk", n / 1000.0);
        return String.format("%.3fM", n / 1_000_000.0);
    }

    private String centerText(String text) {
        int pad = (80 - text.length()) / 2;
        return " ".repeat(Math.max(0, pad)) + text;
    }

    public void printPhaseHeader(String phase) {
        System.out.println("\n\033[1;36m" + "─".repeat(80) + "\n" + phase + "\n" + "─".repeat(80) + "\033[0m");
    }

    public void printSuccess() {
        System.out.println("\n\033[1;32m" + "=".repeat(80) + "\n" + centerText("BUILD COMPLETED SUCCESSFULLY") + "\n" + "=".repeat(80) + "\033[0m");
    }

    public void printError(String message) {
        System.out.println("\n\033[1;31m" + "=".repeat(80) + "\n" + centerText(message) + "\n" + "=".repeat(80) + "\033[0m");
    }
}
