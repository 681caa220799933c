package com.eventanalytics.pipeline.queue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An entry claimed from the queue: the id the queue assigned on enqueue and the
 * flattened event fields, in enqueue order.
 */
public record QueueEntry(String entryId, Map<String, String> fields) {

    public QueueEntry {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String field(String name) {
        return fields.get(name);
    }
}
