package com.di.loannova.orchestrator;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Run ids: {@code run_{sha[:12]}} under the deterministic strategy, so reruns of identical content
 * share an id, otherwise {@code run_{yyyyMMdd_HHmmss}_{sha[:6]}}.
 */
public final class RunIdentity {

    public static final String DETERMINISTIC = "deterministic";

    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private RunIdentity() {
    }

    public static String provisional(Instant startedAt) {
        return "run_" + STAMP.format(startedAt);
    }

    public static String derive(String strategy, String sourceHash, Instant startedAt) {
        if (sourceHash == null || sourceHash.isBlank()) {
            return provisional(startedAt);
        }
        if (DETERMINISTIC.equalsIgnoreCase(strategy)) {
            return "run_" + sourceHash.substring(0, Math.min(12, sourceHash.length()));
        }
        return provisional(startedAt) + "_" + sourceHash.substring(0, Math.min(6, sourceHash.length()));
    }
}
