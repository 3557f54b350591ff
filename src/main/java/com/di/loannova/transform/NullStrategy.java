package com.di.loannova.transform;

import java.util.Locale;

public enum NullStrategy {
    /** Replace nulls with 0; row count unchanged. */
    FILL_ZERO,
    /** Remove rows with a null in any of the configured columns. */
    DROP_ROWS;

    public static NullStrategy from(String value) {
        if (value == null || value.isBlank()) {
            return FILL_ZERO;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown null strategy '" + value + "' (expected fill_zero or drop_rows)", e);
        }
    }
}
