package com.di.loannova.exception;

/**
 * Base of every failure the pipeline raises on purpose.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
