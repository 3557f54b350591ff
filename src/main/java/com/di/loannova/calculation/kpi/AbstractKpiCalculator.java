package com.di.loannova.calculation.kpi;

import com.di.loannova.calculation.KpiCalculator;
import com.di.loannova.calculation.KpiValue;
import com.di.loannova.common.Dataset;
import com.di.loannova.exception.CalculationException;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Shared column checks and context construction for the dataset-level KPIs.
 */
abstract class AbstractKpiCalculator implements KpiCalculator {

    protected KpiValue empty(Instant now) {
        return KpiValue.of(0.0, definition().formula(), 0, 0, now, Map.of("reason", "Empty dataset"));
    }

    protected KpiValue value(double value, Dataset ds, long nulls, Instant now, Map<String, ?> extra) {
        return KpiValue.of(value, definition().formula(), ds.size(), nulls, now, extra);
    }

    protected void requireColumns(Dataset ds, String... columns) {
        List<String> missing = missingColumns(ds, columns);
        if (!missing.isEmpty()) {
            throw new CalculationException(name() + ": missing required columns: " + String.join(", ", missing));
        }
    }

    protected static List<String> missingColumns(Dataset ds, String... columns) {
        return Arrays.stream(columns).filter(c -> !ds.hasColumn(c)).toList();
    }

    protected static long nullCount(Dataset ds, String... columns) {
        long n = 0;
        for (String c : columns) {
            if (ds.hasColumn(c)) n += ds.nullCount(c);
        }
        return n;
    }

    /**
     * {@code raw} limited to [0, 100]. A limited value is flagged in {@code extra} as {@code clamped}
     * together with the {@code unclamped_value}.
     */
    protected static double boundedPercent(double raw, Map<String, Object> extra) {
        double bounded = Math.min(100.0, Math.max(0.0, raw));
        if (bounded != raw) {
            extra.put("clamped", true);
            extra.put("unclamped_value", raw);
        }
        return bounded;
    }

    /** Cell as a number, with nulls and non-numeric values read as zero. */
    protected static double num(Map<String, Object> row, String column) {
        Double d = Dataset.toDouble(row.get(column));
        return d == null || !Double.isFinite(d) ? 0.0 : d;
    }
}
