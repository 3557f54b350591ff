package com.di.loannova.ingestion;

import com.di.loannova.common.ColumnFinder;
import com.di.loannova.common.Dataset;
import com.di.loannova.common.IsoDates;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Scored audit of an ingested dataset.
 *
 * <p>score = 100 - 20 per missing required column - 10 per column with type errors
 * - 2 per checked column containing nulls, floored at 0. Status is {@code failed} when
 * any required column is missing or the score drops below 70.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DataQualityReport(Instant timestamp,
                                String status,
                                double score,
                                int totalRows,
                                List<String> missingColumns,
                                List<String> typeErrors,
                                Map<String, Long> nullCounts) {

    public static final double FAILING_SCORE = 70.0;

    public boolean passed() {
        return "passed".equals(status);
    }

    public static DataQualityReport assess(Dataset dataset, List<String> requiredColumns,
                                           List<String> numericColumns, List<String> dateColumns, Instant now) {
        List<String> missing = new ArrayList<>();
        for (String col : requiredColumns) {
            if (ColumnFinder.findIgnoreCase(dataset.columns(), col).isEmpty()) {
                missing.add(col);
            }
        }

        Map<String, Long> nullCounts = new LinkedHashMap<>();
        Set<String> checked = new LinkedHashSet<>(requiredColumns);
        checked.addAll(numericColumns);
        for (String col : checked) {
            ColumnFinder.findIgnoreCase(dataset.columns(), col)
                    .ifPresent(resolved -> nullCounts.put(col, dataset.nullCount(resolved)));
        }

        List<String> typeErrors = new ArrayList<>();
        for (String col : numericColumns) {
            Optional<String> resolved = ColumnFinder.findIgnoreCase(dataset.columns(), col);
            if (resolved.isPresent() && dataset.values(resolved.get()).stream()
                    .anyMatch(v -> !Dataset.isBlank(v) && Dataset.toDouble(v) == null)) {
                typeErrors.add("Column '" + col + "' contains non-numeric values");
            }
        }
        for (String col : dateColumns) {
            Optional<String> resolved = ColumnFinder.findIgnoreCase(dataset.columns(), col);
            if (resolved.isPresent() && dataset.values(resolved.get()).stream()
                    .anyMatch(v -> !Dataset.isBlank(v) && IsoDates.parseLenient(v).isEmpty())) {
                typeErrors.add("Column '" + col + "' contains invalid date values");
            }
        }

        long columnsWithNulls = nullCounts.values().stream().filter(n -> n > 0).count();
        double score = Math.max(0.0, 100.0 - missing.size() * 20 - typeErrors.size() * 10 - columnsWithNulls * 2);
        String status = !missing.isEmpty() || score < FAILING_SCORE ? "failed" : "passed";
        return new DataQualityReport(now, status, score, dataset.size(),
                List.copyOf(missing), List.copyOf(typeErrors), nullCounts);
    }
}
