package com.di.loannova.common;

import java.util.UUID;

/**
 * Identifiers of the individual phases of a run: {@code ingest_}, {@code tx_}, {@code calc_}, {@code out_}
 * followed by 12 hex characters.
 */
public final class SubRunIds {

    private SubRunIds() {
    }

    public static String next(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
