package com.di.loannova.contract;

/**
 * One broken contract rule.
 *
 * @param column   offending column (or {@code *} for dataset-level rules)
 * @param rule     rule identifier, e.g. {@code required_column}, {@code non_negative}
 * @param message  human-readable detail
 * @param row      zero-based row index, {@code null} for column-level rules
 * @param critical critical violations halt ingestion regardless of strict mode
 */
public record Violation(String column, String rule, String message, Integer row, boolean critical) {

    public static Violation column(String column, String rule, String message) {
        return new Violation(column, rule, message, null, false);
    }

    public static Violation cell(String column, String rule, int row, String message) {
        return new Violation(column, rule, message, row, false);
    }

    public static Violation critical(String column, String rule, Integer row, String message) {
        return new Violation(column, rule, message, row, true);
    }

    @Override
    public String toString() {
        return (row == null ? "" : "row " + row + ": ") + column + " [" + rule + "] " + message;
    }
}
