package com.eventanalytics.pipeline.queue;

import com.eventanalytics.pipeline.exception.MalformedEntryException;
import com.eventanalytics.pipeline.model.EventRecord;
import com.eventanalytics.pipeline.model.PageViewEvent;
import com.eventanalytics.pipeline.model.PageViewPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts page views to queue fields and drained queue entries to {@link EventRecord}s.
 * <p>
 * Queues only carry scalar values, so the payload travels as a JSON string
 * ({@code ""} when absent).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PageViewEventCodec {

    public static final String EVENT_ID = "event_id";
    public static final String USER_ID = "user_id";
    public static final String TIMESTAMP = "timestamp";
    public static final String EVENT_TYPE = "event_type";
    public static final String PAYLOAD = "payload";
    public static final String QUEUED_AT = "queued_at";

    private final ObjectMapper objectMapper;

    public Map<String, String> encode(PageViewEvent event, Instant queuedAt) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(EVENT_ID, event.getEventId().toString());
        fields.put(USER_ID, event.getUserId());
        fields.put(TIMESTAMP, event.getTimestamp().toString());
        fields.put(EVENT_TYPE, event.getEventType().wireName());
        fields.put(PAYLOAD, encodePayload(event.getPayload()));
        fields.put(QUEUED_AT, queuedAt.toString());
        return fields;
    }

    /**
     * Decode a drained entry. Never fails on bad content:
     * <ul>
     *   <li>malformed payload JSON is stored as {@code null}</li>
     *   <li>an unparseable timestamp is kept verbatim, the record is partitioned by its
     *       enqueue time (or {@code processedAt} if that is unparseable too) and flagged</li>
     * </ul>
     */
    public EventRecord decode(QueueEntry entry, Instant processedAt) {
        EventRecord record = EventRecord.builder()
                .queueEntryId(entry.entryId())
                .processedAt(processedAt)
                .eventId(entry.field(EVENT_ID))
                .userId(entry.field(USER_ID))
                .timestamp(entry.field(TIMESTAMP))
                .eventType(entry.field(EVENT_TYPE))
                .queuedAt(entry.field(QUEUED_AT))
                .payload(decodePayload(entry))
                .build();

        try {
            record.setPartitionTime(parseInstant(entry, TIMESTAMP));
        } catch (MalformedEntryException e) {
            log.warn("Entry {} has an unusable {}, partitioning by enqueue time: {}",
                    e.getEntryId(), e.getField(), e.getMessage());
            record.setTimestampParseError(true);
            record.setPartitionTime(fallbackInstant(entry, processedAt));
        }
        return record;
    }

    private String encodePayload(PageViewPayload payload) {
        if (payload == null) {
            return "";
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize page view payload", e);
        }
    }

    private PageViewPayload decodePayload(QueueEntry entry) {
        String raw = entry.field(PAYLOAD);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(raw, PageViewPayload.class);
        } catch (JsonProcessingException e) {
            log.warn("Entry {} has a malformed payload, storing it as null", entry.entryId());
            return null;
        }
    }

    private Instant fallbackInstant(QueueEntry entry, Instant processedAt) {
        try {
            return parseInstant(entry, QUEUED_AT);
        } catch (MalformedEntryException e) {
            return processedAt;
        }
    }

    /**
     * Accepts ISO-8601 date-times with an offset ({@code Z} included); a date-time
     * without an offset is read as UTC.
     */
    static Instant parseInstant(QueueEntry entry, String field) {
        String value = entry.field(field);
        if (value == null || value.isBlank()) {
            throw new MalformedEntryException(entry.entryId(), field, "Missing " + field, null);
        }
        try {
            return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException withOffset) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                throw new MalformedEntryException(entry.entryId(), field,
                        "Unparseable " + field + " '" + value + "'", e);
            }
        }
    }
}
