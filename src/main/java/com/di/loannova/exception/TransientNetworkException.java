package com.di.loannova.exception;

/**
 * Timeout, I/O failure, throttling or 5xx from a remote source. Eligible for retry.
 */
public class TransientNetworkException extends PipelineException {

    public TransientNetworkException(String message) {
        super(message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
