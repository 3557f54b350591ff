package com.di.loannova.exception;

/**
 * Writing an artifact, the manifest or the run state failed. Fatal to the output phase;
 * artifacts already written stay in place for diagnosis.
 */
public class PersistenceException extends PipelineException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
