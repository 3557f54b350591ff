package com.di.loannova.ingestion;

import com.di.loannova.common.Dataset;
import com.di.loannova.common.SubRunIds;
import com.di.loannova.config.PipelineProperties;
import com.di.loannova.contract.CanonicalRecordMapper;
import com.di.loannova.contract.ColumnAliasResolver;
import com.di.loannova.contract.ContractValidator;
import com.di.loannova.contract.LoanTapeSchema;
import com.di.loannova.contract.SchemaContract;
import com.di.loannova.contract.Violation;
import com.di.loannova.exception.ContractViolationException;
import com.di.loannova.observability.ObservabilityContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Phase 1: raw extract to validated canonical loan tape.
 *
 * <p>{@link #acquire} fetches and archives the bytes so the caller can decide idempotency from
 * their hash. {@link #ingest} then runs, in order: adapter parse, alias resolution, core-column
 * check, canonical record mapping, contract validation, strict-mode enforcement, de-duplication
 * and the data-quality audit. Critical violations always halt; others halt only in strict mode.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    private final SourceAdapterRegistry registry;
    private final ContractValidator validator;
    private final PipelineProperties properties;
    private final Clock clock;

    public RawExtract acquire(ObservabilityContext ctx) {
        PipelineProperties.Source source = properties.getSource();
        SourceAdapter adapter = registry.getAdapter(source.getType());
        log.info("[INGESTION] fetching from '{}' source via {}", source.getType(), adapter.getClass().getSimpleName());
        RawExtract extract = adapter.fetch(source, ctx);
        RawExtract archived = new RawArchive(Path.of(properties.getRun().getRawArchiveDir())).archive(extract);
        ctx.event("ingestion", "archive", "success",
                Map.of("file", extract.location(), "archived", String.valueOf(archived.archivedPath())));
        return archived;
    }

    public IngestionResult ingest(RawExtract extract, ObservabilityContext ctx) {
        String runId = SubRunIds.next("ingest");
        PipelineProperties.Validation rules = properties.getValidation();
        SourceAdapter adapter = registry.getAdapter(extract.sourceType());

        Dataset parsed = adapter.parse(extract, properties.getSource(), ctx);
        ColumnAliasResolver.Resolved resolved =
                ColumnAliasResolver.withOverrides(rules.getColumnAliases()).resolve(parsed);
        SchemaContract contract = contract();

        List<Violation> structural = validator.validate(resolved.dataset(),
                SchemaContract.empty().requiring(contract.requiredColumns()));
        failOnCritical(structural);

        CanonicalRecordMapper.Outcome mapped = new CanonicalRecordMapper(clock).mapAll(resolved.dataset());
        List<Violation> violations = new ArrayList<>(mapped.violations());
        violations.addAll(validator.validate(mapped.dataset(), contract));
        failOnCritical(violations);
        if (!violations.isEmpty()) {
            ctx.event("ingestion", "validation", "completed", Map.of("error_count", violations.size()));
            if (rules.isStrict()) {
                throw new ContractViolationException(
                        "Schema validation failed for " + violations.size() + " violation(s)", violations, false);
            }
            log.warn("[INGESTION] {} non-critical violation(s) carried forward (strict=false)", violations.size());
        }

        Dataset dataset = mapped.dataset();
        int deduped = 0;
        if (rules.isDedupEnabled()) {
            Dataset unique = deduplicate(dataset, rules.getDedupKeyColumns());
            deduped = dataset.size() - unique.size();
            dataset = unique;
            if (deduped > 0) {
                ctx.event("ingestion", "deduplication", "completed", Map.of("removed", deduped));
            }
        }

        DataQualityReport quality = DataQualityReport.assess(dataset, contract.requiredColumns(),
                qualityNumericColumns(rules), qualityDateColumns(rules), clock.instant());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source_type", extract.sourceType());
        metadata.put("source", extract.location());
        metadata.put("checksum", extract.sha256());
        metadata.put("archived_path", extract.archivedPath() == null ? null : extract.archivedPath().toString());
        metadata.put("row_count", dataset.size());
        metadata.put("rows_dropped", resolved.dataset().size() - mapped.dataset().size());
        metadata.put("error_count", violations.size());
        metadata.put("validation_errors", violations.stream().map(Violation::toString).toList());
        metadata.put("deduped_count", deduped);
        metadata.put("column_resolution", columnResolution(resolved));
        metadata.put("data_quality_score", quality.score());

        if (ctx.metrics() != null) ctx.metrics().recordRowsIngested(dataset.size());
        log.info("[INGESTION] {} complete: {} row(s), {} violation(s), {} duplicate(s) removed, DQ score {}",
                runId, dataset.size(), violations.size(), deduped, quality.score());
        return new IngestionResult(dataset, runId, extract.sha256(), metadata, quality, violations);
    }

    /** Contract assembled from configuration plus the always-required loan-tape core. */
    public SchemaContract contract() {
        PipelineProperties.Validation rules = properties.getValidation();
        Set<String> dates = new LinkedHashSet<>(rules.getDateColumns());
        dates.add(LoanTapeSchema.MEASUREMENT_DATE);
        return new SchemaContract(
                new ArrayList<>(rules.getRequiredColumns()),
                rules.getNumericColumns(),
                new ArrayList<>(dates),
                rules.getPercentageColumns(),
                rules.getNonNegativeColumns(),
                rules.getKeyColumns(),
                rules.isUniqueKeys())
                .requiring(LoanTapeSchema.CORE_COLUMNS);
    }

    private static void failOnCritical(List<Violation> violations) {
        if (ContractValidator.hasCritical(violations)) {
            List<Violation> critical = violations.stream().filter(Violation::critical).toList();
            throw new ContractViolationException("Critical contract violation: " + critical, violations, true);
        }
    }

    /** First occurrence of each key combination wins; keys absent from the dataset are ignored. */
    static Dataset deduplicate(Dataset dataset, List<String> keyColumns) {
        List<String> keys = keyColumns.stream().filter(dataset::hasColumn).toList();
        if (keys.isEmpty()) {
            return dataset;
        }
        Set<List<String>> seen = new HashSet<>();
        Dataset.Builder out = Dataset.builder(dataset.columns());
        for (Map<String, Object> row : dataset.rows()) {
            List<String> key = keys.stream().map(k -> Dataset.render(row.get(k))).toList();
            if (seen.add(key)) {
                out.addRow(row);
            }
        }
        return out.build();
    }

    private static List<String> qualityNumericColumns(PipelineProperties.Validation rules) {
        Set<String> numeric = new LinkedHashSet<>(LoanTapeSchema.CORE_COLUMNS);
        numeric.addAll(LoanTapeSchema.DEFAULTED_COLUMNS);
        numeric.addAll(rules.getNumericColumns());
        return new ArrayList<>(numeric);
    }

    private static List<String> qualityDateColumns(PipelineProperties.Validation rules) {
        return new ArrayList<>(rules.getDateColumns());
    }

    private static Map<String, Object> columnResolution(ColumnAliasResolver.Resolved resolved) {
        Map<String, Object> out = new LinkedHashMap<>();
        resolved.resolutions().forEach((canonical, r) -> out.put(canonical,
                Map.of("source", r.source(), "candidate", r.candidate(), "match", r.match())));
        return out;
    }
}
