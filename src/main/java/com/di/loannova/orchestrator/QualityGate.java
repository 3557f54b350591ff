package com.di.loannova.orchestrator;

import com.di.loannova.common.Dataset;
import com.di.loannova.common.IsoDates;
import com.di.loannova.contract.LoanTapeSchema;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Run-level data quality gate: completeness of required columns, referential integrity of the
 * key columns and freshness of the latest measurement date.
 */
public final class QualityGate {

    private QualityGate() {
    }

    public static QualityGateResult evaluate(String runId, Dataset ds, List<String> requiredColumns,
                                             List<String> keyColumns, double completenessThreshold,
                                             String sourceType, Instant now) {
        double completeness = completeness(ds, requiredColumns);
        boolean integrity = referentialIntegrity(ds, keyColumns);
        double freshness = freshnessHours(ds, now);

        Map<String, Object> notes = new LinkedHashMap<>();
        notes.put("source", sourceType);
        notes.put("integrity_columns", keyColumns);
        notes.put("completeness_threshold", completenessThreshold);
        notes.put("rows", ds.size());

        boolean passed = completeness >= completenessThreshold && integrity;
        return new QualityGateResult(runId, round(completeness, 4), round(freshness, 2), integrity, passed, notes);
    }

    /** {@code 1 - missing / (rows * required)}; an absent column counts every row as missing. */
    static double completeness(Dataset ds, List<String> required) {
        if (required.isEmpty() || ds.isEmpty()) {
            return 1.0;
        }
        long missing = 0;
        for (String col : required) {
            missing += ds.hasColumn(col) ? ds.nullCount(col) : ds.size();
        }
        double total = (double) ds.size() * required.size();
        return Math.max(0.0, Math.min(1.0, 1.0 - missing / total));
    }

    /** Key columns present, never null, and unique in combination. */
    static boolean referentialIntegrity(Dataset ds, List<String> keys) {
        if (keys.isEmpty()) {
            return true;
        }
        if (keys.stream().anyMatch(k -> !ds.hasColumn(k))) {
            return false;
        }
        Set<List<Object>> seen = new HashSet<>();
        for (Map<String, Object> row : ds.rows()) {
            List<Object> key = keys.stream().map(row::get).toList();
            if (key.stream().anyMatch(Dataset::isBlank) || !seen.add(key)) {
                return false;
            }
        }
        return true;
    }

    /** Zero when no row carries a readable measurement date. */
    static double freshnessHours(Dataset ds, Instant now) {
        if (!ds.hasColumn(LoanTapeSchema.MEASUREMENT_DATE)) {
            return 0.0;
        }
        Optional<LocalDate> latest = ds.values(LoanTapeSchema.MEASUREMENT_DATE).stream()
                .map(IsoDates::parseLenient)
                .flatMap(Optional::stream)
                .max(LocalDate::compareTo);
        return latest
                .map(d -> Duration.between(d.atStartOfDay(ZoneOffset.UTC).toInstant(), now).toSeconds() / 3600.0)
                .orElse(0.0);
    }

    private static double round(double value, int places) {
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }
}
