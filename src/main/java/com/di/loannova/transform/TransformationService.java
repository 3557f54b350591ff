package com.di.loannova.transform;

import com.di.loannova.common.Dataset;
import com.di.loannova.common.SubRunIds;
import com.di.loannova.config.PipelineProperties;
import com.di.loannova.observability.ObservabilityContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Phase 2: normalization, null handling, outlier flagging, PII masking, lineage and quality checks.
 *
 * <p>Steps run in a fixed order because masking relies on normalized column names. The phase is
 * row-preserving unless {@code drop_rows} is configured, and that drop is recorded in lineage.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransformationService {

    public static final String TX_RUN_ID = "_tx_run_id";
    public static final String TX_TIMESTAMP = "_tx_timestamp";
    static final String STAGE = "transformation";

    private final PipelineProperties properties;
    private final Clock clock;

    public TransformationResult transform(Dataset input, ObservabilityContext ctx) {
        String runId = SubRunIds.next("tx");
        PipelineProperties.Transformation cfg = properties.getTransformation();
        List<LineageEvent> lineage = new ArrayList<>();
        List<AccessLogEntry> accessLog = new ArrayList<>();
        String user = ctx.user();

        step(lineage, runId, "start", "initiated", Map.of("input_rows", input.size()));
        accessLog.add(AccessLogEntry.of(STAGE, user, "read", "success", clock.instant()));

        try {
            Dataset ds = normalize(input, cfg);
            step(lineage, runId, "normalization", "success", Map.of("columns", ds.columns()));

            int before = ds.size();
            ds = handleNulls(ds, NullStrategy.from(cfg.getNullStrategy()), cfg.getNullColumns());
            step(lineage, runId, "null_handling", "success", Map.of(
                    "strategy", cfg.getNullStrategy(), "columns", cfg.getNullColumns(), "rows_dropped", before - ds.size()));

            Map<String, OutlierDetector.Flag> outliers = cfg.isOutlierEnabled()
                    ? OutlierDetector.detect(ds, cfg.getOutlierZscoreThreshold())
                    : Map.of();
            step(lineage, runId, "outlier_detection", outliers.isEmpty() ? "clean" : "flagged",
                    Map.of("details", outliers));

            PiiMasker.Masked masked = cfg.isPiiEnabled()
                    ? new PiiMasker(cfg.getPiiKeywords(), cfg.getPiiColumns(), cfg.getPiiAction()).apply(ds)
                    : new PiiMasker.Masked(ds, Set.of());
            ds = masked.dataset();
            step(lineage, runId, "pii_masking", "completed",
                    Map.of("masked_columns", List.copyOf(masked.columns()), "action", cfg.getPiiAction()));
            accessLog.add(AccessLogEntry.of(STAGE, user, "mask_pii", "success", clock.instant()));

            String inputHash = input.contentHash();
            String outputHash = ds.contentHash();
            step(lineage, runId, "lineage", "captured", Map.of("input_hash", inputHash, "output_hash", outputHash));

            Instant txTime = clock.instant();
            Dataset.Builder withAudit = ds.toBuilder().addColumn(TX_RUN_ID).addColumn(TX_TIMESTAMP);
            for (Map<String, Object> row : withAudit.rows()) {
                row.put(TX_RUN_ID, runId);
                row.put(TX_TIMESTAMP, txTime.toString());
            }
            ds = withAudit.build();
            step(lineage, runId, "audit_columns", "added", Map.of("columns", List.of(TX_RUN_ID, TX_TIMESTAMP)));

            Map<String, Boolean> checks = QualityChecks.run(ds);
            long failed = checks.values().stream().filter(ok -> !ok).count();
            step(lineage, runId, "quality_checks", "completed", Map.of("checks", checks.size(), "failed", failed));
            step(lineage, runId, "complete", "success", Map.of("output_rows", ds.size()));

            log.info("[TRANSFORM] {} complete: {} row(s), masked {}, {} outlier column(s), {}/{} checks passing",
                    runId, ds.size(), masked.columns(), outliers.size(), checks.size() - failed, checks.size());
            return new TransformationResult(ds, runId, masked.columns(), accessLog, checks, lineage, outliers,
                    inputHash, outputHash, clock.instant());
        } catch (RuntimeException e) {
            accessLog.add(new AccessLogEntry(STAGE, user, "error", "failed", clock.instant(), e.getMessage()));
            step(lineage, runId, "fatal_error", "failed", Map.of("error", String.valueOf(e.getMessage())));
            log.error("[TRANSFORM] {} failed: {}", runId, e.getMessage());
            throw e;
        }
    }

    static Dataset normalize(Dataset input, PipelineProperties.Transformation cfg) {
        List<String> columns = new ArrayList<>();
        Map<String, String> rename = new LinkedHashMap<>();
        for (String c : input.columns()) {
            String n = cfg.isLowercaseColumns() ? c.trim().toLowerCase(Locale.ROOT) : c;
            rename.put(c, n);
            columns.add(n);
        }
        Dataset.Builder out = Dataset.builder(columns);
        for (Map<String, Object> row : input.rows()) {
            Map<String, Object> r = new LinkedHashMap<>();
            row.forEach((k, v) -> r.put(rename.get(k),
                    cfg.isStripWhitespace() && v instanceof String s ? s.strip() : v));
            out.addRow(r);
        }
        return out.build();
    }

    /** An empty column list leaves the dataset unchanged. */
    static Dataset handleNulls(Dataset input, NullStrategy strategy, List<String> columns) {
        List<String> targets = columns.stream().filter(input::hasColumn).toList();
        if (targets.isEmpty()) {
            return input;
        }
        Dataset.Builder out = Dataset.builder(input.columns());
        for (Map<String, Object> row : input.rows()) {
            boolean hasNull = targets.stream().anyMatch(c -> Dataset.isBlank(row.get(c)));
            if (!hasNull) {
                out.addRow(row);
            } else if (strategy == NullStrategy.FILL_ZERO) {
                Map<String, Object> filled = new LinkedHashMap<>(row);
                targets.forEach(c -> {
                    if (Dataset.isBlank(filled.get(c))) filled.put(c, 0.0);
                });
                out.addRow(filled);
            }
        }
        return out.build();
    }

    private void step(List<LineageEvent> lineage, String runId, String step, String status, Map<String, Object> details) {
        lineage.add(new LineageEvent(runId, step, status, clock.instant(), details));
        log.info("[TRANSFORM] {} {} | {}", step, status, details);
    }
}
