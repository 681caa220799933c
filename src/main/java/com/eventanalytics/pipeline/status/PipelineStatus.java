package com.eventanalytics.pipeline.status;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time status of the pipeline. Queue figures are null and {@code error} is set
 * when the queue could not be read.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineStatus(
        @JsonProperty("stream_length") Long queueLength,
        @JsonProperty("pending_messages") Long pendingMessages,
        @JsonProperty("is_processor_running") boolean processorRunning,
        @JsonProperty("files_count") long filesCount,
        @JsonProperty("files_size_bytes") long filesSizeBytes,
        @JsonProperty("files_size_mb") double filesSizeMb,
        @JsonProperty("error") String error
) {}
