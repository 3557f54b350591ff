package com.di.loannova.common;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable in-memory table that flows between pipeline phases.
 *
 * <p>Column order is fixed at construction and every row holds exactly those keys
 * (absent values are {@code null}). Phases never mutate a dataset; they derive a new
 * one through {@link #toBuilder()} or {@link #builder(List)}.
 */
public final class Dataset {

    private static final Pattern NUMERIC = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");

    private final List<String>              columns;
    private final List<Map<String, Object>> rows;

    private Dataset(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = columns;
        this.rows    = rows;
    }

    public static Dataset of(List<String> columns, List<? extends Map<String, ?>> rows) {
        Builder b = builder(columns);
        rows.forEach(b::addRow);
        return b.build();
    }

    public static Dataset empty() {
        return new Dataset(List.of(), List.of());
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    public Builder toBuilder() {
        Builder b = new Builder(columns);
        rows.forEach(b::addRow);
        return b;
    }

    /* ------------------------------------------------------------------ */
    /* Accessors                                                            */
    /* ------------------------------------------------------------------ */

    public List<String> columns() {
        return columns;
    }

    public List<Map<String, Object>> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public Object value(int row, String column) {
        return rows.get(row).get(column);
    }

    public List<Object> values(String column) {
        List<Object> out = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            out.add(row.get(column));
        }
        return out;
    }

    /** Numeric view of a column; non-numeric and missing cells map to {@code null}. */
    public List<Double> numbers(String column) {
        List<Double> out = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            out.add(toDouble(row.get(column)));
        }
        return out;
    }

    /** Sum of the numeric cells of a column, ignoring nulls and non-numeric values. */
    public double sum(String column) {
        double total = 0.0;
        for (Map<String, Object> row : rows) {
            Double d = toDouble(row.get(column));
            if (d != null && Double.isFinite(d)) {
                total += d;
            }
        }
        return total;
    }

    public long nullCount(String column) {
        return rows.stream().filter(r -> isBlank(r.get(column))).count();
    }

    /**
     * SHA-256 over a canonical CSV rendering (header plus rows, fixed column order).
     * Equal content always yields the same hash.
     */
    public String contentHash() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.join(",", columns)).append('\n');
        for (Map<String, Object> row : rows) {
            for (int i = 0; i < columns.size(); i++) {
                if (i > 0) sb.append(',');
                sb.append(render(row.get(columns.get(i))));
            }
            sb.append('\n');
        }
        return Hashing.sha256Hex(sb.toString().getBytes(StandardCharsets.UTF_8));
    }

    /* ------------------------------------------------------------------ */
    /* Value helpers                                                        */
    /* ------------------------------------------------------------------ */

    /** Lenient numeric coercion: numbers pass through, numeric strings parse, anything else is null. */
    public static Double toDouble(Object value) {
        if (value == null) return null;
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String s) {
            String t = s.trim();
            if (t.isEmpty() || !NUMERIC.matcher(t).matches()) return null;
            return Double.parseDouble(t);
        }
        return null;
    }

    public static boolean isBlank(Object value) {
        if (value == null) return true;
        if (value instanceof String s) return s.isBlank();
        if (value instanceof Double d) return d.isNaN();
        return false;
    }

    /** Canonical text form used for hashing and row-oriented output. */
    public static String render(Object value) {
        if (value == null) return "";
        if (value instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) return d.toString();
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dataset other)) return false;
        return columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "Dataset{columns=" + columns + ", rows=" + rows.size() + "}";
    }

    /* ------------------------------------------------------------------ */
    /* Builder                                                              */
    /* ------------------------------------------------------------------ */

    public static final class Builder {

        private final LinkedHashSet<String>     columns;
        private final List<Map<String, Object>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            this.columns = new LinkedHashSet<>(columns);
        }

        public Builder addColumn(String column) {
            columns.add(column);
            return this;
        }

        public Builder addRow(Map<String, ?> row) {
            rows.add(new LinkedHashMap<>(row));
            return this;
        }

        public List<String> columns() {
            return List.copyOf(columns);
        }

        /** Mutable working rows; only valid until {@link #build()}. */
        public List<Map<String, Object>> rows() {
            return rows;
        }

        public Dataset build() {
            List<String> cols = List.copyOf(columns);
            List<Map<String, Object>> frozen = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                Map<String, Object> projected = new LinkedHashMap<>();
                for (String c : cols) {
                    projected.put(c, row.get(c));
                }
                frozen.add(Collections.unmodifiableMap(projected));
            }
            return new Dataset(cols, Collections.unmodifiableList(frozen));
        }
    }
}
