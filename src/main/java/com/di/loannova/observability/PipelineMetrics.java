package com.di.loannova.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for pipeline runs, phases, KPIs and the remote-call guards.
 */
@Slf4j
@Component
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;

    private final DistributionSummary rowsIngested;
    private final Counter             httpRetries;
    private final Counter             circuitRejections;
    private final Counter             cloudUploads;

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.rowsIngested = DistributionSummary.builder("loannova.rows.ingested")
                .description("Rows emitted by the ingestion phase per run")
                .baseUnit("rows")
                .register(meterRegistry);

        this.httpRetries = Counter.builder("loannova.http.retries")
                .description("HTTP ingestion attempts that were retried")
                .register(meterRegistry);

        this.circuitRejections = Counter.builder("loannova.http.circuit.rejections")
                .description("HTTP calls rejected because the circuit was open")
                .register(meterRegistry);

        this.cloudUploads = Counter.builder("loannova.cloud.uploads")
                .description("Artifacts exported to the cloud object store")
                .register(meterRegistry);
    }

    // ---- runs / phases ------------------------------------------------------

    public void recordRun(String status) {
        Counter.builder("loannova.runs")
                .description("Pipeline runs by terminal status")
                .tag("status", status)
                .register(meterRegistry)
                .increment();
        log.debug("Recorded run status={}", status);
    }

    public void recordPhase(String phase, long durationMs) {
        Timer.builder("loannova.phase.duration")
                .description("Wall-clock duration of a pipeline phase")
                .tag("phase", phase)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordRowsIngested(long rows) {
        rowsIngested.record(rows);
    }

    // ---- calculation --------------------------------------------------------

    public void recordKpiFailure(String kpi) {
        Counter.builder("loannova.kpi.failures")
                .description("KPI evaluations that faulted and were isolated")
                .tag("kpi", kpi)
                .register(meterRegistry)
                .increment();
    }

    // ---- remote calls -------------------------------------------------------

    public void recordHttpRetry() {
        httpRetries.increment();
    }

    public void recordCircuitRejection() {
        circuitRejections.increment();
    }

    public void recordCloudUpload() {
        cloudUploads.increment();
    }
}
