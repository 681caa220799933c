package com.eventanalytics.pipeline.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Count of one minute bucket. {@code minuteTimestamp} is the start of the minute,
 * e.g. {@code 2024-01-15T14:05:00Z}.
 */
public record MinuteCount(
        @JsonProperty("minute_timestamp") String minuteTimestamp,
        @JsonProperty("bucket_key") String bucketKey,
        @JsonProperty("count") long count,
        @JsonProperty("distinct_users") int distinctUsers
) {}
