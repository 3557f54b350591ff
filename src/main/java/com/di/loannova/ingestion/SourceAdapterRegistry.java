package com.di.loannova.ingestion;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registry of {@link SourceAdapter} beans keyed by their normalized type.
 *
 * <p>Lookup is case-insensitive and trimmed. Two adapters claiming the same type fail startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SourceAdapterRegistry {

    private final List<SourceAdapter> adapters;

    private Map<String, SourceAdapter> adaptersByType;

    @PostConstruct
    void initialize() {
        if (adapters == null || adapters.isEmpty()) {
            log.warn("[INGESTION] No SourceAdapter beans found. Registry will be empty.");
            adaptersByType = Collections.emptyMap();
            return;
        }

        Map<String, List<SourceAdapter>> grouped = adapters.stream()
                .peek(SourceAdapterRegistry::validateType)
                .collect(Collectors.groupingBy(a -> normalizeType(a.type())));

        String duplicates = grouped.entrySet().stream()
                .filter(e -> e.getValue().size() > 1)
                .map(e -> String.format("'%s' -> [%s]", e.getKey(), e.getValue().stream()
                        .map(a -> a.getClass().getName()).collect(Collectors.joining(", "))))
                .collect(Collectors.joining(" ; "));
        if (!duplicates.isEmpty()) {
            throw new IllegalStateException("Duplicate SourceAdapter type() values detected: " + duplicates);
        }

        adaptersByType = grouped.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> e.getValue().get(0)));
        log.info("[INGESTION] Registered {} source adapter type(s): {}", adaptersByType.size(), adaptersByType.keySet());
    }

    /**
     * @throws IllegalArgumentException if the type is blank or unknown
     */
    public SourceAdapter getAdapter(String type) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Source type cannot be null or blank");
        }
        SourceAdapter adapter = adaptersByType.get(normalizeType(type));
        if (adapter == null) {
            throw new IllegalArgumentException(String.format(
                    "Unsupported source type: '%s'. Available types: %s", type, adaptersByType.keySet()));
        }
        return adapter;
    }

    public Set<String> getRegisteredTypes() {
        return Collections.unmodifiableSet(adaptersByType.keySet());
    }

    public boolean hasAdapter(String type) {
        return type != null && !type.isBlank() && adaptersByType.containsKey(normalizeType(type));
    }

    private static void validateType(SourceAdapter adapter) {
        if (adapter.type() == null || adapter.type().isBlank()) {
            throw new IllegalStateException(String.format(
                    "Adapter %s returned blank type(). Adapter type must be non-null and non-blank.",
                    adapter.getClass().getName()));
        }
    }

    private static String normalizeType(String type) {
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
