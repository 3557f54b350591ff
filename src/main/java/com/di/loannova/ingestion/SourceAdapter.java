package com.di.loannova.ingestion;

import com.di.loannova.common.Dataset;
import com.di.loannova.config.PipelineProperties;
import com.di.loannova.observability.ObservabilityContext;

/**
 * A kind of loan-tape source. Fetching and parsing are separate so the orchestrator can
 * decide idempotency from the raw bytes before any parsing happens.
 */
public interface SourceAdapter {

    /** The source type key used in configuration, e.g. {@code file}. */
    String type();

    /** Reads the raw extract. Network adapters apply their resilience guards here. */
    RawExtract fetch(PipelineProperties.Source source, ObservabilityContext ctx);

    /**
     * Turns the raw bytes into a table. Shape-converting adapters return canonical loan-tape
     * columns and raise {@link com.di.loannova.exception.SchemaDriftException} on unknown shapes.
     */
    Dataset parse(RawExtract extract, PipelineProperties.Source source, ObservabilityContext ctx);
}
