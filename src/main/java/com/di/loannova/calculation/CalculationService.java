package com.di.loannova.calculation;

import com.di.loannova.calculation.kpi.PortfolioHealthCalculator;
import com.di.loannova.common.Dataset;
import com.di.loannova.common.Result;
import com.di.loannova.common.SubRunIds;
import com.di.loannova.config.PipelineProperties;
import com.di.loannova.observability.ObservabilityContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Phase 3: evaluates every registered KPI over the transformed dataset.
 *
 * <p>Each KPI is isolated: a failure is recorded as a metric without value and never stops the
 * others. The composite health score is only computed when PAR30 and the collection rate both
 * succeeded. Every attempt is appended to the audit trail.
 */
@Slf4j
@Service
public class CalculationService {

    private final List<KpiCalculator> calculators;
    private final PortfolioHealthCalculator healthCalculator;
    private final PipelineProperties properties;
    private final Clock clock;

    public CalculationService(List<KpiCalculator> calculators,
                              PortfolioHealthCalculator healthCalculator,
                              PipelineProperties properties,
                              Clock clock) {
        this.calculators = calculators.stream()
                .sorted(Comparator.comparingInt(c -> KpiCatalog.order(c.name())))
                .toList();
        this.healthCalculator = healthCalculator;
        this.properties = properties;
        this.clock = clock;
        log.info("[CALC] registered KPIs: {}", this.calculators.stream().map(KpiCalculator::name).toList());
    }

    public List<KpiCalculator> calculators() {
        return calculators;
    }

    /**
     * @param baseline metric values of the most recent prior run, or an empty map
     */
    public CalculationResult calculate(Dataset ds, Map<String, Double> baseline, ObservabilityContext ctx) {
        String runId = SubRunIds.next("calc");
        PipelineProperties.Calculation cfg = properties.getCalculation();
        Instant now = clock.instant();
        List<AuditEvent> audit = new ArrayList<>();
        audit(audit, ctx, "calculate_all", "started", null, Map.of("rows", ds.size(), "kpi_count", calculators.size()));

        Map<String, MetricResult> metrics = new LinkedHashMap<>();
        for (KpiCalculator calc : calculators) {
            KpiDefinition def = KpiCatalog.resolve(calc.name(), cfg.getThresholds());
            Result<KpiValue, String> outcome = evaluate(calc, ds, now);
            record(metrics, audit, ctx, def, outcome, "kpi");
        }

        KpiDefinition healthDef = KpiCatalog.resolve(KpiCatalog.PORTFOLIO_HEALTH, cfg.getThresholds());
        MetricResult par30 = metrics.get(KpiCatalog.PAR30);
        MetricResult collection = metrics.get(KpiCatalog.COLLECTION_RATE);
        if (par30 != null && par30.succeeded() && collection != null && collection.succeeded()) {
            Result<KpiValue, String> health = Result.success(
                    healthCalculator.calculate(par30.value(), collection.value(), now));
            record(metrics, audit, ctx, healthDef, health, "composite_kpi");
        } else {
            record(metrics, audit, ctx, healthDef,
                    Result.failure("Missing inputs for composite metric " + healthDef.name()), "composite_kpi");
        }

        Map<String, Dataset> timeseries = cfg.isTimeseriesEnabled() ? timeseries(ds, cfg, now, audit, ctx) : Map.of();
        List<AnomalyFlag> anomalies = cfg.isAnomalyEnabled()
                ? AnomalyDetector.detect(metrics, baseline, cfg.getAnomalyMaxChangePct())
                : List.of();
        anomalies.forEach(a -> log.warn("[CALC] anomaly {}: {} -> {} ({} change)",
                a.metric(), a.previous(), a.current(), a.changePct()));

        audit(audit, ctx, "calculate_all", "completed", null, Map.of(
                "kpi_count", metrics.size(), "anomaly_count", anomalies.size(), "rollups", timeseries.keySet()));
        log.info("[CALC] {} complete: {} KPI(s), {} failed, {} anomaly(ies)",
                runId, metrics.size(), metrics.values().stream().filter(m -> !m.succeeded()).count(), anomalies.size());
        return new CalculationResult(runId, metrics, audit, anomalies, timeseries, clock.instant());
    }

    static Result<KpiValue, String> evaluate(KpiCalculator calc, Dataset ds, Instant now) {
        try {
            KpiValue value = calc.calculate(ds, now);
            if (!Double.isFinite(value.value())) {
                return Result.failure(calc.name() + " produced a non-finite value");
            }
            return Result.success(value);
        } catch (RuntimeException e) {
            return Result.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void record(Map<String, MetricResult> metrics, List<AuditEvent> audit, ObservabilityContext ctx,
                        KpiDefinition def, Result<KpiValue, String> outcome, String eventPrefix) {
        if (outcome.isSuccess()) {
            MetricResult m = MetricResult.success(def, outcome.getValue());
            metrics.put(def.name(), m);
            audit(audit, ctx, eventPrefix + "_calculated", "success", def.name(),
                    Map.of("value", m.value(), "status", m.status().code()));
            log.debug("[CALC] {} = {} ({})", def.name(), m.value(), m.status().code());
        } else {
            metrics.put(def.name(), MetricResult.failure(def, outcome.getError()));
            audit(audit, ctx, eventPrefix + "_calculation_failed", "error", def.name(),
                    Map.of("error", outcome.getError()));
            if (ctx.metrics() != null) ctx.metrics().recordKpiFailure(def.name());
            log.warn("[CALC] {} failed: {}", def.name(), outcome.getError());
        }
    }

    private Map<String, Dataset> timeseries(Dataset ds, PipelineProperties.Calculation cfg, Instant now,
                                            List<AuditEvent> audit, ObservabilityContext ctx) {
        String timeColumn = cfg.getTimeseriesTimeColumn();
        if (timeColumn == null || !ds.hasColumn(timeColumn)) {
            log.info("[CALC] timeseries skipped: column '{}' not present", timeColumn);
            return Map.of();
        }
        Map<String, Dataset> out = new LinkedHashMap<>();
        for (String code : cfg.getTimeseriesRollups()) {
            TimeseriesRollup.fromCode(code).ifPresentOrElse(
                    rollup -> out.put(rollup.code(), rollup.compute(ds, timeColumn, calculators, now,
                            (kpi, e) -> audit(audit, ctx, "timeseries_metric_failed", "error", kpi,
                                    Map.of("rollup", rollup.code(), "error", String.valueOf(e.getMessage()))))),
                    () -> log.warn("[CALC] unknown timeseries rollup '{}' ignored", code));
        }
        return out;
    }

    private void audit(List<AuditEvent> audit, ObservabilityContext ctx, String event, String status,
                       String kpi, Map<String, Object> details) {
        audit.add(new AuditEvent(event, status, kpi, clock.instant(), ctx.user(), ctx.action(), details));
    }
}
