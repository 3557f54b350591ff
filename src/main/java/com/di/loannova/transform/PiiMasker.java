package com.di.loannova.transform;

import com.di.loannova.common.Dataset;
import com.di.loannova.common.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Replaces PII values with a stable digest ({@code MASKED:} + first 16 hex of SHA-256 of the text)
 * or with {@code [REDACTED]}. A column is PII when its name contains one of the keywords or it
 * is listed explicitly. Nulls stay null.
 */
public class PiiMasker {

    public static final String MASK_PREFIX = "MASKED:";
    /** Hex digits of the digest kept in a token (64 bits). */
    static final int TOKEN_HEX_LENGTH = 16;
    public static final String REDACTED = "[REDACTED]";

    public enum Action { MASK, REDACT }

    /** Masked dataset plus the columns that were touched, in column order. */
    public record Masked(Dataset dataset, Set<String> columns) {
    }

    private final List<String> keywords;
    private final Set<String> explicitColumns;
    private final Action action;

    public PiiMasker(Collection<String> keywords, Collection<String> explicitColumns, String action) {
        this.keywords = keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
        this.explicitColumns = new LinkedHashSet<>(explicitColumns);
        this.action = "redact".equalsIgnoreCase(action) ? Action.REDACT : Action.MASK;
    }

    public Set<String> detect(List<String> columns) {
        Set<String> hits = new LinkedHashSet<>();
        for (String column : columns) {
            String lower = column.toLowerCase(Locale.ROOT);
            if (explicitColumns.contains(column) || keywords.stream().anyMatch(lower::contains)) {
                hits.add(column);
            }
        }
        return hits;
    }

    public Masked apply(Dataset dataset) {
        Set<String> targets = detect(dataset.columns());
        if (targets.isEmpty()) {
            return new Masked(dataset, Set.of());
        }
        List<Map<String, Object>> rows = new ArrayList<>(dataset.size());
        for (Map<String, Object> row : dataset.rows()) {
            Map<String, Object> out = new LinkedHashMap<>(row);
            for (String column : targets) {
                out.put(column, protect(row.get(column)));
            }
            rows.add(out);
        }
        return new Masked(Dataset.of(dataset.columns(), rows), targets);
    }

    Object protect(Object value) {
        if (value == null || (value instanceof Double d && d.isNaN())) {
            return value;
        }
        if (action == Action.REDACT) {
            return REDACTED;
        }
        return mask(value);
    }

    public static String mask(Object value) {
        String digest = Hashing.sha256Hex(Dataset.render(value).getBytes(StandardCharsets.UTF_8));
        return MASK_PREFIX + digest.substring(0, TOKEN_HEX_LENGTH);
    }
}
