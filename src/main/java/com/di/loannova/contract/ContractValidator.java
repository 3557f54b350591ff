package com.di.loannova.contract;

import com.di.loannova.common.Dataset;
import com.di.loannova.common.IsoDates;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks a {@link Dataset} against a {@link SchemaContract}.
 *
 * <p>The validator only reports; whether a violation halts the run is decided by the
 * caller (strict flag at ingestion, fail-open at the quality gate). Critical violations
 * are flagged on the {@link Violation} itself.
 */
@Slf4j
@Component
public class ContractValidator {

    private final Clock clock;

    public ContractValidator(Clock clock) {
        this.clock = clock;
    }

    public List<Violation> validate(Dataset dataset, SchemaContract contract) {
        List<Violation> violations = new ArrayList<>(contract.definitionErrors());
        if (!violations.isEmpty()) {
            // rules of a malformed contract are not evaluated
            return violations;
        }

        for (String column : contract.requiredColumns()) {
            if (!dataset.hasColumn(column)) {
                violations.add(Violation.critical(column, "required_column", null,
                        "required column '" + column + "' not found"));
            }
        }

        checkNumeric(dataset, contract, violations);
        checkDates(dataset, contract, violations);
        checkBounds(dataset, contract, violations);
        checkKeys(dataset, contract, violations);

        if (!violations.isEmpty()) {
            log.debug("[CONTRACT] {} violation(s) over {} rows", violations.size(), dataset.size());
        }
        return violations;
    }

    public static boolean hasCritical(List<Violation> violations) {
        return violations.stream().anyMatch(Violation::critical);
    }

    // ── rules ───────────────────────────────────────────────────────────

    private void checkNumeric(Dataset ds, SchemaContract c, List<Violation> out) {
        for (String column : c.numericColumns()) {
            if (!ds.hasColumn(column)) continue;
            for (int i = 0; i < ds.size(); i++) {
                Object v = ds.value(i, column);
                if (!Dataset.isBlank(v) && Dataset.toDouble(v) == null) {
                    out.add(Violation.cell(column, "numeric", i, "non-numeric value '" + v + "'"));
                }
            }
        }
    }

    private void checkDates(Dataset ds, SchemaContract c, List<Violation> out) {
        LocalDate today = LocalDate.now(clock);
        for (String column : c.dateColumns()) {
            if (!ds.hasColumn(column)) continue;
            for (int i = 0; i < ds.size(); i++) {
                Object v = ds.value(i, column);
                if (Dataset.isBlank(v)) continue;
                Optional<LocalDate> date = IsoDates.parseIso(v);
                if (date.isEmpty()) {
                    out.add(Violation.cell(column, "iso8601", i, "not an ISO-8601 date: '" + v + "'"));
                } else if (date.get().isAfter(today)) {
                    out.add(Violation.critical(column, "future_date", i,
                            "future-dated record " + date.get() + " (today " + today + ")"));
                }
            }
        }
    }

    private void checkBounds(Dataset ds, SchemaContract c, List<Violation> out) {
        for (String column : c.percentageColumns()) {
            if (!ds.hasColumn(column)) continue;
            List<Double> values = ds.numbers(column);
            for (int i = 0; i < values.size(); i++) {
                Double d = values.get(i);
                if (d != null && (d < 0.0 || d > 100.0)) {
                    out.add(Violation.cell(column, "percentage_bounds", i, d + " outside [0, 100]"));
                }
            }
        }
        for (String column : c.nonNegativeColumns()) {
            if (!ds.hasColumn(column)) continue;
            List<Double> values = ds.numbers(column);
            for (int i = 0; i < values.size(); i++) {
                Double d = values.get(i);
                if (d != null && d < 0.0) {
                    out.add(Violation.cell(column, "non_negative", i, "negative amount " + d));
                }
            }
        }
    }

    private void checkKeys(Dataset ds, SchemaContract c, List<Violation> out) {
        List<String> keys = c.keyColumns();
        if (keys.isEmpty()) return;
        for (String key : keys) {
            if (!ds.hasColumn(key)) {
                out.add(Violation.column(key, "key_column", "key column '" + key + "' not found"));
            }
        }
        if (keys.stream().anyMatch(k -> !ds.hasColumn(k))) return;

        Set<List<Object>> seen = new HashSet<>();
        for (int i = 0; i < ds.size(); i++) {
            Map<String, Object> row = ds.rows().get(i);
            List<Object> composite = new ArrayList<>(keys.size());
            boolean hasNull = false;
            for (String key : keys) {
                Object v = row.get(key);
                hasNull |= Dataset.isBlank(v);
                composite.add(v == null ? null : Dataset.render(v));
            }
            if (hasNull) {
                out.add(Violation.cell(String.join("+", keys), "key_not_null", i, "null key value"));
            } else if (c.uniqueKeys() && !seen.add(composite)) {
                out.add(Violation.cell(String.join("+", keys), "key_unique", i, "duplicate key " + composite));
            }
        }
    }
}
