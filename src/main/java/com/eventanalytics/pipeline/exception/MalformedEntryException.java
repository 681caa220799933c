package com.eventanalytics.pipeline.exception;

import lombok.Getter;

/**
 * A drained queue entry carries a field that cannot be parsed.
 * The writer tolerates it: the record is still persisted with a fallback.
 */
@Getter
public class MalformedEntryException extends PipelineException {

    private final String entryId;
    private final String field;

    public MalformedEntryException(String entryId, String field, String message, Throwable cause) {
        super("MALFORMED_ENTRY", message, cause);
        this.entryId = entryId;
        this.field = field;
    }
}
