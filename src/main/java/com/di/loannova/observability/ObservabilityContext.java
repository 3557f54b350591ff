package com.di.loannova.observability;

import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Per-run logging and tracing handle, created by the orchestrator and passed
 * explicitly into every phase.
 *
 * <p>Holds the run identity, the actor, a run-scoped logger, the Micrometer
 * {@link ObservationRegistry} used as tracer, and {@link PipelineMetrics}. While open
 * it keeps {@code runId} in the MDC; {@link #span} additionally sets {@code phase}.
 */
public final class ObservabilityContext implements AutoCloseable {

    public static final String MDC_RUN_ID = "runId";
    public static final String MDC_PHASE  = "phase";

    private static final Logger RUN_LOG = LoggerFactory.getLogger("com.di.loannova.run");

    private final ObservationRegistry observations;
    private final PipelineMetrics     metrics;
    private final String              user;
    private final String              action;
    private volatile String           runId;

    public ObservabilityContext(String runId, String user, String action,
                                ObservationRegistry observations, PipelineMetrics metrics) {
        this.runId        = runId;
        this.user         = user;
        this.action       = action;
        this.observations = observations == null ? ObservationRegistry.NOOP : observations;
        this.metrics      = metrics;
        MDC.put(MDC_RUN_ID, runId);
    }

    /** Context for tests and tools that need no meters or traces. */
    public static ObservabilityContext noop(String runId) {
        return new ObservabilityContext(runId, "system", "manual", ObservationRegistry.NOOP, null);
    }

    public String runId() {
        return runId;
    }

    /** The run id is provisional until the source hash is known. */
    public void rebind(String newRunId) {
        this.runId = newRunId;
        MDC.put(MDC_RUN_ID, newRunId);
    }

    public String user() {
        return user;
    }

    public String action() {
        return action;
    }

    public Logger log() {
        return RUN_LOG;
    }

    public PipelineMetrics metrics() {
        return metrics;
    }

    /**
     * Runs {@code work} inside a named observation, tagging it with the run id and
     * recording the phase duration.
     */
    public <T> T span(String name, Supplier<T> work) {
        String previousPhase = MDC.get(MDC_PHASE);
        MDC.put(MDC_PHASE, name);
        long start = System.currentTimeMillis();
        try {
            return Observation.createNotStarted("loannova." + name, observations)
                    .lowCardinalityKeyValue("phase", name)
                    .highCardinalityKeyValue("run.id", runId)
                    .observe(work);
        } finally {
            if (metrics != null) metrics.recordPhase(name, System.currentTimeMillis() - start);
            if (previousPhase == null) MDC.remove(MDC_PHASE); else MDC.put(MDC_PHASE, previousPhase);
        }
    }

    /** Structured phase event on the run log. */
    public void event(String phase, String event, String status, Map<String, ?> details) {
        RUN_LOG.info("[{}] {} {} | {}", phase.toUpperCase(), event, status, details);
    }

    @Override
    public void close() {
        MDC.remove(MDC_RUN_ID);
        MDC.remove(MDC_PHASE);
    }
}
