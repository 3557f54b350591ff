package com.di.loannova.exception;

/**
 * A single KPI could not be computed. Caught per KPI and never aborts the run.
 */
public class CalculationException extends PipelineException {

    public CalculationException(String message) {
        super(message);
    }
}
