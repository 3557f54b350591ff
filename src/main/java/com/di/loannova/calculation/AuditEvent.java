package com.di.loannova.calculation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/** One entry in the append-only KPI audit trail. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(String event,
                         String status,
                         String kpi,
                         Instant timestamp,
                         String actor,
                         String action,
                         Map<String, Object> details) {

    public AuditEvent {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
