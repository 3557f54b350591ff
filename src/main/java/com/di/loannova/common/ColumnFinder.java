package com.di.loannova.common;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves a logical field to one of the physical columns of a source.
 *
 * <p>Candidates are tried in priority order within each tier, and the tiers run
 * from strictest to loosest: exact, case-insensitive, normalized token
 * (non-alphanumerics collapsed), then substring of the normalized token.
 */
public final class ColumnFinder {

    public enum MatchKind { EXACT, CASE_INSENSITIVE, NORMALIZED, SUBSTRING }

    public record Match(String column, String candidate, MatchKind kind) {
    }

    private ColumnFinder() {
    }

    public static Optional<Match> find(Collection<String> columns, List<String> candidates) {
        return find(columns, candidates, Set.of());
    }

    /**
     * @param excluded columns already claimed by another field; never returned
     */
    public static Optional<Match> find(Collection<String> columns, List<String> candidates, Set<String> excluded) {
        if (candidates == null || candidates.isEmpty()) return Optional.empty();

        for (String candidate : candidates) {
            if (columns.contains(candidate) && !excluded.contains(candidate)) {
                return Optional.of(new Match(candidate, candidate, MatchKind.EXACT));
            }
        }

        Map<String, String> lower = new LinkedHashMap<>();
        Map<String, String> normalized = new LinkedHashMap<>();
        for (String column : columns) {
            if (excluded.contains(column)) continue;
            lower.putIfAbsent(column.toLowerCase(Locale.ROOT), column);
            normalized.putIfAbsent(normalize(column), column);
        }

        for (String candidate : candidates) {
            String hit = lower.get(candidate.toLowerCase(Locale.ROOT));
            if (hit != null) return Optional.of(new Match(hit, candidate, MatchKind.CASE_INSENSITIVE));
        }
        for (String candidate : candidates) {
            String hit = normalized.get(normalize(candidate));
            if (hit != null) return Optional.of(new Match(hit, candidate, MatchKind.NORMALIZED));
        }
        for (String candidate : candidates) {
            String token = normalize(candidate);
            if (token.isEmpty()) continue;
            for (Map.Entry<String, String> e : normalized.entrySet()) {
                if (e.getKey().contains(token)) {
                    return Optional.of(new Match(e.getValue(), candidate, MatchKind.SUBSTRING));
                }
            }
        }
        return Optional.empty();
    }

    /** Case-insensitive lookup only; used where a loose match would be wrong. */
    public static Optional<String> findIgnoreCase(Collection<String> columns, String name) {
        for (String column : columns) {
            if (column.equalsIgnoreCase(name)) return Optional.of(column);
        }
        return Optional.empty();
    }

    static String normalize(String value) {
        return value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").trim();
    }
}
