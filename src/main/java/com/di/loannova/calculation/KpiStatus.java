package com.di.loannova.calculation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum KpiStatus {
    OK,
    WARNING,
    CRITICAL,
    UNKNOWN;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isAlert() {
        return this == WARNING || this == CRITICAL;
    }
}
