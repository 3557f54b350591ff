package com.di.loannova.ingestion;

import com.di.loannova.common.ColumnFinder;
import com.di.loannova.common.Dataset;
import com.di.loannova.common.IsoDates;
import com.di.loannova.exception.PipelineException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Reads cash balances per date from a financials CSV. A directory resolves to its most recently
 * modified CSV. The last value seen for a date wins. Any problem yields an empty map: cash then
 * defaults to zero in the snapshot rows.
 */
@Slf4j
public class CashBalanceLoader {

    private final TabularParser parser;

    public CashBalanceLoader(TabularParser parser) {
        this.parser = parser;
    }

    public Map<String, Double> load(String location, List<String> dateCandidates, List<String> cashCandidates) {
        Map<String, Double> cashByDate = new TreeMap<>();
        if (location == null || location.isBlank()) {
            return cashByDate;
        }
        Optional<Path> file = resolve(Path.of(location));
        if (file.isEmpty()) {
            log.info("[INGESTION] financials skipped: nothing found at {}", location);
            return cashByDate;
        }

        Dataset financials;
        try {
            financials = parser.parseCsv(Files.readAllBytes(file.get()));
        } catch (IOException | PipelineException e) {
            log.warn("[INGESTION] financials skipped: cannot read {}: {}", file.get(), e.getMessage());
            return cashByDate;
        }

        Optional<String> dateCol = firstIgnoreCase(financials.columns(), dateCandidates);
        Optional<String> cashCol = firstIgnoreCase(financials.columns(), cashCandidates);
        if (dateCol.isEmpty() || cashCol.isEmpty()) {
            log.warn("[INGESTION] financials skipped: no date/cash columns in {} (available: {})",
                    file.get(), financials.columns());
            return cashByDate;
        }

        for (Map<String, Object> row : financials.rows()) {
            Optional<LocalDate> date = IsoDates.parseLenient(row.get(dateCol.get()));
            Double cash = Dataset.toDouble(row.get(cashCol.get()));
            if (date.isPresent() && cash != null && Double.isFinite(cash)) {
                cashByDate.put(date.get().toString(), cash);
            }
        }
        log.info("[INGESTION] financials loaded from {}: {} date(s)", file.get(), cashByDate.size());
        return cashByDate;
    }

    private static Optional<String> firstIgnoreCase(List<String> columns, List<String> candidates) {
        for (String candidate : candidates) {
            Optional<String> hit = ColumnFinder.findIgnoreCase(columns, candidate);
            if (hit.isPresent()) return hit;
        }
        return Optional.empty();
    }

    private static Optional<Path> resolve(Path path) {
        if (Files.isRegularFile(path)) {
            return Optional.of(path);
        }
        if (!Files.isDirectory(path)) {
            return Optional.empty();
        }
        try (Stream<Path> files = Files.list(path)) {
            return files.filter(p -> p.getFileName().toString().toLowerCase().endsWith(".csv"))
                    .max(Comparator.comparing(CashBalanceLoader::modifiedMillis));
        } catch (IOException e) {
            log.warn("[INGESTION] cannot list financials directory {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private static long modifiedMillis(Path path) {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            log.debug("[INGESTION] no modification time for {}: {}", path, e.getMessage());
            return 0L;
        }
    }
}
