package com.di.loannova.transform;

import com.di.loannova.common.Dataset;
import com.di.loannova.common.IsoDates;
import com.di.loannova.contract.LoanTapeSchema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Boolean post-transformation checks, keyed {@code {column}_{check}}. They flag; they never halt.
 */
public final class QualityChecks {

    static final Set<String> PERCENT_EXEMPT = Set.of("collateralization_pct", "collection_rate_pct");

    /** Canonical monetary fields plus the loan-level analytics fields. */
    static final List<String> NOT_NULL_COLUMNS = Stream.concat(
            Stream.concat(LoanTapeSchema.CORE_COLUMNS.stream(), LoanTapeSchema.DEFAULTED_COLUMNS.stream()),
            Stream.of("loan_amount", "appraised_value", "borrower_income", "monthly_debt",
                    "loan_status", "interest_rate", "principal_balance")).toList();

    private QualityChecks() {
    }

    public static Map<String, Boolean> run(Dataset dataset) {
        Map<String, Boolean> checks = new LinkedHashMap<>();
        for (String column : dataset.columns()) {
            if (column.startsWith("_tx_")) continue;
            if (isMonetary(column)) {
                checks.put(column + "_non_negative", dataset.values(column).stream().allMatch(v -> {
                    Double d = Dataset.toDouble(v);
                    return d != null && d >= 0;
                }));
            }
        }
        for (String column : dataset.columns()) {
            if (isPercentage(column)) {
                checks.put(column + "_in_0_100", dataset.values(column).stream().allMatch(v -> {
                    Double d = Dataset.toDouble(v);
                    return d != null && d >= 0 && d <= 100;
                }));
            }
        }
        for (String column : dataset.columns()) {
            if (isDate(column)) {
                checks.put(column + "_iso8601", dataset.values(column).stream()
                        .allMatch(v -> Dataset.isBlank(v) || (v instanceof String && IsoDates.isIso8601(v))));
            }
        }
        for (String column : NOT_NULL_COLUMNS) {
            if (dataset.hasColumn(column)) {
                checks.put(column + "_no_nulls", dataset.nullCount(column) == 0);
            }
        }
        return checks;
    }

    static boolean isMonetary(String column) {
        String c = column.toLowerCase(Locale.ROOT);
        return c.endsWith("_usd") || c.contains("amount") || c.contains("balance");
    }

    static boolean isPercentage(String column) {
        String c = column.toLowerCase(Locale.ROOT);
        return (c.contains("percent") || c.contains("rate") || c.endsWith("_pct"))
                && !PERCENT_EXEMPT.contains(c);
    }

    static boolean isDate(String column) {
        String c = column.toLowerCase(Locale.ROOT);
        return c.contains("date") || c.endsWith("_at");
    }
}
