package com.eventanalytics.pipeline.status;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * @param eventCount lines in the file, -1 if the file could not be read
 */
public record PartitionFileInfo(
        @JsonProperty("path") String path,
        @JsonProperty("size_bytes") long sizeBytes,
        @JsonProperty("size_mb") double sizeMb,
        @JsonProperty("modified") Instant modified,
        @JsonProperty("event_count") long eventCount
) {}
