package com.eventanalytics.pipeline.exception;

/**
 * The queue or counter store could not be reached. Callers retry or degrade; never fatal.
 */
public class TransientStoreException extends PipelineException {

    public TransientStoreException(String message, Throwable cause) {
        super("STORE_UNAVAILABLE", message, cause);
    }
}
