package com.di.loannova.contract;

import com.di.loannova.common.ColumnFinder;
import com.di.loannova.common.Dataset;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Renames heterogeneous source columns to canonical loan-tape names.
 *
 * <p>Each canonical field claims at most one source column, and a source column is
 * claimed at most once. Unmatched columns keep their names.
 */
@Slf4j
public final class ColumnAliasResolver {

    /** How one canonical field was resolved; recorded into ingestion metadata. */
    public record Resolution(String source, String candidate, String match) {
    }

    public record Resolved(Dataset dataset, Map<String, Resolution> resolutions) {
    }

    private final Map<String, List<String>> aliases;

    public ColumnAliasResolver(Map<String, List<String>> aliases) {
        this.aliases = new LinkedHashMap<>(aliases);
    }

    /** Built-in aliases with {@code overrides} taking precedence per canonical field. */
    public static ColumnAliasResolver withOverrides(Map<String, List<String>> overrides) {
        Map<String, List<String>> merged = LoanTapeSchema.defaultAliases();
        if (overrides != null) merged.putAll(overrides);
        return new ColumnAliasResolver(merged);
    }

    public Resolved resolve(Dataset dataset) {
        List<String> columns = dataset.columns();
        Set<String> claimed = new HashSet<>();
        Map<String, String> renames = new LinkedHashMap<>();
        Map<String, Resolution> resolutions = new LinkedHashMap<>();

        // exact canonical names are claimed first so aliases never steal them
        for (String canonical : aliases.keySet()) {
            if (columns.contains(canonical)) {
                claimed.add(canonical);
                resolutions.put(canonical, new Resolution(canonical, canonical, ColumnFinder.MatchKind.EXACT.name()));
            }
        }
        for (Map.Entry<String, List<String>> e : aliases.entrySet()) {
            String canonical = e.getKey();
            if (resolutions.containsKey(canonical)) continue;
            Optional<ColumnFinder.Match> match = ColumnFinder.find(columns, e.getValue(), claimed);
            if (match.isEmpty() || columns.contains(canonical)) continue;
            ColumnFinder.Match m = match.get();
            claimed.add(m.column());
            renames.put(m.column(), canonical);
            resolutions.put(canonical, new Resolution(m.column(), m.candidate(), m.kind().name()));
        }

        if (renames.isEmpty()) {
            return new Resolved(dataset, resolutions);
        }
        log.info("[CONTRACT] column aliases applied: {}", renames);

        List<String> renamedColumns = new ArrayList<>(columns.size());
        for (String c : columns) renamedColumns.add(renames.getOrDefault(c, c));
        Dataset.Builder b = Dataset.builder(renamedColumns);
        for (Map<String, Object> row : dataset.rows()) {
            Map<String, Object> out = new LinkedHashMap<>();
            row.forEach((k, v) -> out.put(renames.getOrDefault(k, k), v));
            b.addRow(out);
        }
        return new Resolved(b.build(), resolutions);
    }
}
