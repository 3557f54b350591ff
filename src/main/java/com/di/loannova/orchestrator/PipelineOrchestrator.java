package com.di.loannova.orchestrator;

import com.di.loannova.calculation.CalculationResult;
import com.di.loannova.calculation.CalculationService;
import com.di.loannova.config.PipelineProperties;
import com.di.loannova.exception.ContractViolationException;
import com.di.loannova.exception.ErrorCategory;
import com.di.loannova.exception.PersistenceException;
import com.di.loannova.exception.SchemaDriftException;
import com.di.loannova.ingestion.IngestionResult;
import com.di.loannova.ingestion.IngestionService;
import com.di.loannova.ingestion.RawExtract;
import com.di.loannova.observability.ObservabilityContext;
import com.di.loannova.observability.PipelineMetrics;
import com.di.loannova.output.DatasetWriter;
import com.di.loannova.output.ManifestReader;
import com.di.loannova.output.OutputRequest;
import com.di.loannova.output.OutputResult;
import com.di.loannova.output.OutputService;
import com.di.loannova.transform.TransformationResult;
import com.di.loannova.transform.TransformationService;
import io.micrometer.observation.ObservationRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the four phases strictly in sequence and owns everything around them: run identity,
 * idempotency against the run-state file, the quality gate, compliance and summary artifacts,
 * alerts and the run-state update.
 *
 * <h3>Run artifacts</h3>
 * <pre>
 *   {artifacts-dir}/latest.json                    summary of the most recent run
 *   {artifacts-dir}/state.json                     last published raw hash per source
 *   {artifacts-dir}/{run}/run_summary.json
 *   {artifacts-dir}/{run}/quality.json
 *   {artifacts-dir}/{run}/schema_diff.json         only on schema drift
 *   {artifacts-dir}/{run}/{run}_compliance.json
 *   {artifacts-dir}/{run}/{run}_manifest.json
 * </pre>
 *
 * A skipped run writes {@code latest.json} only, so no existing artifact changes.
 */
@Slf4j
@Service
public class PipelineOrchestrator {

    static final String LATEST = "latest.json";
    static final String RUN_SUMMARY = "run_summary.json";
    static final String QUALITY = "quality.json";
    static final String SCHEMA_DIFF = "schema_diff.json";

    private final IngestionService ingestion;
    private final TransformationService transformation;
    private final CalculationService calculation;
    private final OutputService output;
    private final ManifestReader manifestReader;
    private final DatasetWriter writer;
    private final AlertDispatcher alerts;
    private final PipelineProperties properties;
    private final PipelineMetrics metrics;
    private final ObservationRegistry observations;
    private final Clock clock;

    public PipelineOrchestrator(IngestionService ingestion,
                                TransformationService transformation,
                                CalculationService calculation,
                                OutputService output,
                                ManifestReader manifestReader,
                                DatasetWriter writer,
                                AlertDispatcher alerts,
                                PipelineProperties properties,
                                ObjectProvider<PipelineMetrics> metrics,
                                ObjectProvider<ObservationRegistry> observations,
                                Clock clock) {
        this.ingestion = ingestion;
        this.transformation = transformation;
        this.calculation = calculation;
        this.output = output;
        this.manifestReader = manifestReader;
        this.writer = writer;
        this.alerts = alerts;
        this.properties = properties;
        this.metrics = metrics.getIfAvailable();
        this.observations = observations.getIfAvailable(() -> ObservationRegistry.NOOP);
        this.clock = clock;
    }

    public RunSummary run(RunRequest request) {
        PipelineProperties.Run runCfg = properties.getRun();
        boolean force = request.force() != null ? request.force() : runCfg.isForce();
        String user = request.user() != null ? request.user() : runCfg.getUser();
        String action = request.action() != null ? request.action() : runCfg.getAction();
        Instant started = clock.instant();

        try (ObservabilityContext ctx = new ObservabilityContext(
                RunIdentity.provisional(started), user, action, observations, metrics)) {
            log.info("[ORCHESTRATOR] run started: source={} user={} action={} force={}",
                    properties.getSource().getType(), user, action, force);
            RunSummary summary = execute(ctx, started, force);
            if (metrics != null) metrics.recordRun(summary.getStatus().code());
            log.info("[ORCHESTRATOR] run {} finished: {}{}", summary.getRunId(), summary.getStatus().code(),
                    summary.getReason() == null ? "" : " (" + summary.getReason() + ")");
            return summary;
        }
    }

    private RunSummary execute(ObservabilityContext ctx, Instant started, boolean force) {
        Path artifactsDir = Path.of(properties.getRun().getArtifactsDir());

        RawExtract extract;
        try {
            extract = ctx.span("acquire", () -> ingestion.acquire(ctx));
        } catch (RuntimeException e) {
            return finish(artifactsDir, failure(ctx.runId(), started, e, null, null), true);
        }

        String runId = RunIdentity.derive(properties.getRun().getIdStrategy(), extract.sha256(), started);
        ctx.rebind(runId);
        Map<String, Object> input = input(extract);

        RunStateStore stateStore = new RunStateStore(Path.of(properties.getRun().getStateFile()));
        if (!force) {
            Optional<String> previous = previousRun(stateStore.load(), extract, artifactsDir);
            if (previous.isPresent()) {
                log.info("[ORCHESTRATOR] input {} already processed ({}); skipping", extract.stateKey(), previous.get());
                RunSummary skipped = base(runId, RunStatus.SKIPPED, started).reason("idempotent").input(input).build();
                return finish(artifactsDir, skipped, false);
            }
        }

        Path runDir = artifactsDir.resolve(runId);
        Map<String, Object> phases = new LinkedHashMap<>();
        try {
            IngestionResult ingested = ctx.span("ingestion", () -> ingestion.ingest(extract, ctx));
            phases.put("ingestion", Map.of("run_id", ingested.runId(), "rows", ingested.dataset().size()));
            List<String> sent = new ArrayList<>();
            alerts.dataQuality(runId, ingested.qualityReport().score()).ifPresent(sent::add);

            QualityGateResult gate = QualityGate.evaluate(runId, ingested.dataset(),
                    ingestion.contract().requiredColumns(), properties.getValidation().getKeyColumns(),
                    properties.getValidation().getCompletenessThreshold(), extract.sourceType(), clock.instant());
            writer.writeJson(gate, runDir.resolve(QUALITY));
            if (!gate.passed() && properties.getValidation().isEnabled()) {
                log.warn("[ORCHESTRATOR] quality gate failed: completeness={} integrity={}",
                        gate.completeness(), gate.referentialIntegrityPass());
                return finish(artifactsDir, base(runId, RunStatus.QUALITY_GATE_FAILED, started)
                        .reason("quality_gate_failed").input(input).phases(phases).quality(gate).alerts(sent).build(), true);
            }

            TransformationResult transformed = ctx.span("transformation",
                    () -> transformation.transform(ingested.dataset(), ctx));
            phases.put("transformation", Map.of("run_id", transformed.runId(),
                    "rows", transformed.dataset().size(), "masked_columns", List.copyOf(transformed.maskedColumns())));

            Map<String, Double> baseline = manifestReader.latestBaseline(artifactsDir, runId);
            CalculationResult calculated = ctx.span("calculation",
                    () -> calculation.calculate(transformed.dataset(), baseline, ctx));
            phases.put("calculation", Map.of("run_id", calculated.runId(),
                    "metrics", List.copyOf(calculated.metrics().keySet()), "anomalies", calculated.anomalies().size()));

            sent.addAll(alerts.kpiAlerts(runId, calculated.metrics()));

            Path compliancePath = writer.writeJson(compliance(runId, ingested, transformed, ctx),
                    runDir.resolve(runId + ComplianceReport.FILE_SUFFIX));

            OutputResult out = ctx.span("output", () -> output.persist(new OutputRequest(
                    runId, extract.sha256(), transformed.dataset(), calculated,
                    outputMetadata(ingested, transformed, calculated, ctx),
                    subRuns(runId, ingested, transformed, calculated),
                    transformed.qualityChecks(), compliancePath, force), ctx));
            if (out.skipped()) {
                return finish(artifactsDir, base(runId, RunStatus.SKIPPED, started).reason("idempotent")
                        .input(input).manifest(out.manifestPath().toString()).build(), false);
            }
            phases.put("output", Map.of("run_id", out.runId(), "files", out.files()));

            stateStore.save(stateStore.load().record(extract.stateKey(), extract.sha256(), runId, clock.instant()));

            return finish(artifactsDir, base(runId, RunStatus.SUCCESS, started)
                    .input(input).phases(phases).metrics(calculated.values()).alerts(sent).quality(gate)
                    .manifest(out.manifestPath().toString()).build(), true);

        } catch (SchemaDriftException e) {
            Map<String, Object> diff = new LinkedHashMap<>();
            diff.put("missing", e.getMissingColumns());
            diff.put("unexpected", e.getUnexpectedColumns());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("run_id", runId);
            payload.put("status", RunStatus.SCHEMA_DRIFT.code());
            payload.put("diff", diff);
            writeSchemaDiff(payload, runDir.resolve(SCHEMA_DIFF));
            log.error("[ORCHESTRATOR] schema drift: missing={} unexpected={}",
                    e.getMissingColumns(), e.getUnexpectedColumns());
            return finish(artifactsDir, base(runId, RunStatus.SCHEMA_DRIFT, started).reason("schema_drift")
                    .error(e.getMessage()).errorCategory(ErrorCategory.SCHEMA_DRIFT.name())
                    .input(input).phases(phases).schemaDiff(diff).build(), true);

        } catch (ContractViolationException e) {
            if (e.isCritical()) {
                alerts.contractViolation(runId, e);
            }
            String reason = e.isCritical() ? "critical_contract_violation" : "contract_violation";
            log.error("[ORCHESTRATOR] {}: {}", reason, e.getMessage());
            return finish(artifactsDir, failure(runId, started, e, input, phases).toBuilder().reason(reason).build(), true);

        } catch (RuntimeException e) {
            log.error("[ORCHESTRATOR] run {} failed: {}", runId, e.getMessage(), e);
            return finish(artifactsDir, failure(runId, started, e, input, phases), true);
        }
    }

    /** Run that already published this exact input, by run-state file or by an existing manifest. */
    private Optional<String> previousRun(RunState state, RawExtract extract, Path artifactsDir) {
        if (state.matches(extract.stateKey(), extract.sha256())) {
            return Optional.of("run state: " + state.lastRunId());
        }
        return manifestReader.findBySourceHash(artifactsDir, extract.sha256()).map(p -> "manifest: " + p);
    }

    private RunSummary.RunSummaryBuilder base(String runId, RunStatus status, Instant started) {
        return RunSummary.builder().runId(runId).status(status).startedAt(started).completedAt(clock.instant());
    }

    private RunSummary failure(String runId, Instant started, RuntimeException e,
                               Map<String, Object> input, Map<String, Object> phases) {
        ErrorCategory category = ErrorCategory.categorize(e);
        return base(runId, RunStatus.FAILED, started)
                .reason(category.name().toLowerCase(Locale.ROOT))
                .error(e.getMessage())
                .errorCategory(category.name())
                .input(input)
                .phases(phases)
                .build();
    }

    /** A write failure is logged; the run still ends as schema drift. */
    private void writeSchemaDiff(Map<String, Object> payload, Path target) {
        try {
            writer.writeJson(payload, target);
        } catch (PersistenceException e) {
            log.error("[ORCHESTRATOR] could not write {}: {}", target, e.getMessage());
        }
    }

    /**
     * Writes {@code latest.json} and, unless {@code perRun} is off, {@code {run}/run_summary.json}.
     * A write failure is logged and does not change the reported outcome.
     */
    private RunSummary finish(Path artifactsDir, RunSummary summary, boolean perRun) {
        try {
            if (perRun) {
                writer.writeJson(summary, artifactsDir.resolve(summary.getRunId()).resolve(RUN_SUMMARY));
            }
            writer.writeJson(summary, artifactsDir.resolve(LATEST));
        } catch (PersistenceException e) {
            log.error("[ORCHESTRATOR] could not write run summary for {}: {}", summary.getRunId(), e.getMessage());
        }
        return summary;
    }

    private static Map<String, Object> input(RawExtract extract) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("source_type", extract.sourceType());
        input.put("location", extract.location());
        input.put("sha256", extract.sha256());
        input.put("archive_path", extract.archivedPath() == null ? null : extract.archivedPath().toString());
        return input;
    }

    private ComplianceReport compliance(String runId, IngestionResult ingested, TransformationResult transformed,
                                        ObservabilityContext ctx) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("user", ctx.user());
        metadata.put("action", ctx.action());
        metadata.put("source", ingested.metadata().get("source"));
        metadata.put("checksum", ingested.sourceHash());
        return new ComplianceReport(runId, clock.instant(), "transformation",
                List.copyOf(transformed.maskedColumns()), transformed.accessLog(), metadata);
    }

    private static Map<String, Object> outputMetadata(IngestionResult ingested, TransformationResult transformed,
                                                      CalculationResult calculated, ObservabilityContext ctx) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("ingestion", ingested.metadata());
        metadata.put("data_quality", ingested.qualityReport());
        metadata.put("lineage", transformed.lineage());
        metadata.put("outliers", transformed.outliers());
        metadata.put("calculation_audit", calculated.auditTrail());
        metadata.put("context", Map.of("user", ctx.user(), "action", ctx.action()));
        return metadata;
    }

    private static Map<String, String> subRuns(String runId, IngestionResult ingested,
                                               TransformationResult transformed, CalculationResult calculated) {
        Map<String, String> subRuns = new LinkedHashMap<>();
        subRuns.put("pipeline", runId);
        subRuns.put("ingestion", ingested.runId());
        subRuns.put("transformation", transformed.runId());
        subRuns.put("calculation", calculated.runId());
        return subRuns;
    }
}
