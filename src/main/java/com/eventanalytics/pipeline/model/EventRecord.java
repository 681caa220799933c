package com.eventanalytics.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One line of a partition file: the drained event plus processing metadata.
 *
 * The event fields are kept as the strings carried by the queue entry, so a record
 * always reflects what was enqueued even when parts of it could not be parsed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"queue_entry_id", "processed_at", "event_id", "user_id", "timestamp",
        "event_type", "queued_at", "payload", "timestamp_parse_error"})
public class EventRecord {

    @JsonProperty("queue_entry_id")
    private String queueEntryId;

    @JsonProperty("processed_at")
    private Instant processedAt;

    @JsonProperty("event_id")
    private String eventId;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("event_type")
    private String eventType;

    @JsonProperty("queued_at")
    private String queuedAt;

    @JsonProperty("payload")
    private PageViewPayload payload;

    // Only present on records partitioned by a fallback instant
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("timestamp_parse_error")
    private Boolean timestampParseError;

    // Instant that decides the hour partition, not written to disk
    @JsonIgnore
    private Instant partitionTime;
}
