package com.di.loannova.calculation;

import com.di.loannova.common.Dataset;
import com.di.loannova.common.IsoDates;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.BiConsumer;

/**
 * Re-evaluates the dataset-level KPIs per calendar period.
 *
 * <p>Each rollup yields a dataset with a {@code period_start} column followed by one column per
 * KPI; a KPI that cannot be computed for a period gets {@code null} in that row.
 */
public enum TimeseriesRollup {

    DAILY {
        @Override
        public LocalDate periodStart(LocalDate date) {
            return date;
        }
    },
    /** ISO weeks, starting on Monday. */
    WEEKLY {
        @Override
        public LocalDate periodStart(LocalDate date) {
            return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        }
    },
    MONTHLY {
        @Override
        public LocalDate periodStart(LocalDate date) {
            return date.withDayOfMonth(1);
        }
    };

    public static final String PERIOD_START = "period_start";

    public abstract LocalDate periodStart(LocalDate date);

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<TimeseriesRollup> fromCode(String code) {
        for (TimeseriesRollup r : values()) {
            if (r.code().equalsIgnoreCase(code == null ? "" : code.trim())) {
                return Optional.of(r);
            }
        }
        return Optional.empty();
    }

    /**
     * Groups rows by the period of {@code timeColumn} and evaluates every calculator per group.
     * Rows whose date cannot be read are left out.
     *
     * @param onFailure receives the KPI name and the failure of a single period evaluation
     */
    public Dataset compute(Dataset ds, String timeColumn, List<KpiCalculator> calculators,
                           Instant now, BiConsumer<String, RuntimeException> onFailure) {
        TreeMap<LocalDate, Dataset.Builder> groups = new TreeMap<>();
        for (Map<String, Object> row : ds.rows()) {
            IsoDates.parseLenient(row.get(timeColumn)).ifPresent(date ->
                    groups.computeIfAbsent(periodStart(date), k -> Dataset.builder(ds.columns())).addRow(row));
        }
        List<String> columns = new ArrayList<>();
        columns.add(PERIOD_START);
        calculators.forEach(c -> columns.add(c.name()));

        Dataset.Builder out = Dataset.builder(columns);
        groups.forEach((period, builder) -> {
            Dataset group = builder.build();
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(PERIOD_START, period.toString());
            for (KpiCalculator calc : calculators) {
                try {
                    row.put(calc.name(), calc.calculate(group, now).value());
                } catch (RuntimeException e) {
                    row.put(calc.name(), null);
                    onFailure.accept(calc.name(), e);
                }
            }
            out.addRow(row);
        });
        return out.build();
    }
}
