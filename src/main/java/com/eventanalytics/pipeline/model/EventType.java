package com.eventanalytics.pipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event types accepted by the pipeline. The wire name doubles as the minute bucket key prefix.
 */
public enum EventType {
    PAGE_VIEW("page_view");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolve a wire name, e.g. "page_view".
     *
     * @throws IllegalArgumentException for unknown names
     */
    @JsonCreator
    public static EventType fromWireName(String value) {
        for (EventType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported event_type: " + value);
    }
}
