package com.di.loannova.calculation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Value of a KPI together with the context it was computed in.
 *
 * <p>The context always carries {@code formula}, {@code rows_processed}, {@code null_count}
 * and {@code timestamp}; calculators append their own intermediate sums.
 */
public record KpiValue(double value, Map<String, Object> context) {

    public KpiValue {
        context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static KpiValue of(double value, String formula, int rowsProcessed, long nullCount,
                              Instant timestamp, Map<String, ?> extra) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("formula", formula);
        ctx.put("rows_processed", rowsProcessed);
        ctx.put("null_count", nullCount);
        ctx.put("timestamp", timestamp.toString());
        ctx.putAll(extra);
        return new KpiValue(value, ctx);
    }

    public String formula() {
        return (String) context.get("formula");
    }

    public int rowsProcessed() {
        return ((Number) context.get("rows_processed")).intValue();
    }
}
