package com.eventanalytics.pipeline.exception;

/**
 * Configuration problem that prevents the processor from starting, e.g. a storage root
 * that cannot be created.
 */
public class FatalConfigException extends PipelineException {

    public FatalConfigException(String message, Throwable cause) {
        super("FATAL_CONFIG", message, cause);
    }
}
