package com.di.loannova.transform;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One compliance access-log touch: who did what to the data at which stage.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccessLogEntry(String stage, String user, String action, String status, Instant timestamp,
                             String message) {

    public static AccessLogEntry of(String stage, String user, String action, String status, Instant timestamp) {
        return new AccessLogEntry(stage, user, action, status, timestamp, null);
    }
}
