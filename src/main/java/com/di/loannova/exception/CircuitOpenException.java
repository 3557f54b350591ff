package com.di.loannova.exception;

/**
 * Call rejected by an open circuit breaker. No network attempt was made.
 */
public class CircuitOpenException extends PipelineException {

    private final String breakerName;

    public CircuitOpenException(String breakerName) {
        super("Circuit breaker '" + breakerName + "' is open; call rejected without attempt");
        this.breakerName = breakerName;
    }

    public String getBreakerName() {
        return breakerName;
    }
}
