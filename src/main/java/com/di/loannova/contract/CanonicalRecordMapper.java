package com.di.loannova.contract;

import com.di.loannova.common.Dataset;
import com.di.loannova.common.IsoDates;
import com.di.loannova.common.Result;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.di.loannova.contract.LoanTapeSchema.*;

/**
 * Maps source rows onto the canonical loan-tape record.
 *
 * <p>Core monetary fields are required, the cash and dpd buckets default to zero, every
 * monetary field must be non-negative and the dpd buckets may not exceed the total
 * receivable. Rows that fail are excluded and reported; extra columns pass through.
 */
public final class CanonicalRecordMapper {

    private static final double TOLERANCE = 1e-6;

    /** Rows that satisfied the record contract plus everything that did not. */
    public record Outcome(Dataset dataset, List<Violation> violations) {
    }

    private final Clock clock;

    public CanonicalRecordMapper(Clock clock) {
        this.clock = clock;
    }

    public Outcome mapAll(Dataset source) {
        List<String> columns = new ArrayList<>();
        columns.add(LOAN_ID);
        columns.addAll(CORE_COLUMNS);
        columns.addAll(DEFAULTED_COLUMNS);
        columns.add(MEASUREMENT_DATE);
        for (String c : source.columns()) {
            if (!columns.contains(c)) columns.add(c);
        }

        Dataset.Builder out = Dataset.builder(columns);
        List<Violation> violations = new ArrayList<>();
        for (int i = 0; i < source.size(); i++) {
            Result<Map<String, Object>, List<Violation>> mapped = map(source.rows().get(i), i);
            if (mapped.isSuccess()) {
                out.addRow(mapped.getValue());
            } else {
                violations.addAll(mapped.getError());
            }
        }
        return new Outcome(out.build(), violations);
    }

    public Result<Map<String, Object>, List<Violation>> map(Map<String, Object> row, int index) {
        List<Violation> errors = new ArrayList<>();
        Map<String, Object> record = new LinkedHashMap<>(row);

        Object id = row.get(LOAN_ID);
        record.put(LOAN_ID, Dataset.isBlank(id) ? "agg_" + index : Dataset.render(id).trim());

        for (String column : CORE_COLUMNS) {
            Object raw = row.get(column);
            if (Dataset.isBlank(raw)) {
                errors.add(Violation.cell(column, "required_value", index, "missing value"));
                continue;
            }
            amount(column, raw, index, errors).ifPresent(v -> record.put(column, v));
        }
        for (String column : DEFAULTED_COLUMNS) {
            Object raw = row.get(column);
            if (Dataset.isBlank(raw)) {
                record.put(column, 0.0);
                continue;
            }
            amount(column, raw, index, errors).ifPresent(v -> record.put(column, v));
        }

        if (errors.isEmpty()) {
            double buckets = 0.0;
            for (String b : DPD_BUCKETS) buckets += (Double) record.get(b);
            double total = (Double) record.get(TOTAL_RECEIVABLE_USD);
            if (buckets > total + TOLERANCE) {
                errors.add(Violation.cell(TOTAL_RECEIVABLE_USD, "dpd_sum_exceeds_total", index,
                        "dpd buckets " + buckets + " exceed total receivable " + total));
            }
        }

        Object date = row.get(MEASUREMENT_DATE);
        if (Dataset.isBlank(date)) {
            record.put(MEASUREMENT_DATE, null);
        } else {
            Optional<LocalDate> parsed = IsoDates.parseIso(date);
            if (parsed.isEmpty()) {
                errors.add(Violation.cell(MEASUREMENT_DATE, "iso8601", index, "not an ISO-8601 date: '" + date + "'"));
            } else if (parsed.get().isAfter(LocalDate.now(clock))) {
                errors.add(Violation.critical(MEASUREMENT_DATE, "future_date", index,
                        "future-dated record " + parsed.get()));
            } else {
                record.put(MEASUREMENT_DATE, date.toString().trim());
            }
        }

        return errors.isEmpty() ? Result.success(record) : Result.failure(errors);
    }

    private static Optional<Double> amount(String column, Object raw, int index, List<Violation> errors) {
        Double value = Dataset.toDouble(raw);
        if (value == null || !Double.isFinite(value)) {
            errors.add(Violation.cell(column, "numeric", index, "non-numeric value '" + raw + "'"));
            return Optional.empty();
        }
        if (value < 0) {
            errors.add(Violation.cell(column, "non_negative", index, "negative amount " + value));
            return Optional.empty();
        }
        return Optional.of(value);
    }
}
