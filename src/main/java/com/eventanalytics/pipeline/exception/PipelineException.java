package com.eventanalytics.pipeline.exception;

/**
 * Base exception for pipeline errors. Every subtype carries a stable error code
 * used in logs and HTTP problem responses.
 */
public class PipelineException extends RuntimeException {

    private final String errorCode;

    public PipelineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public PipelineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
