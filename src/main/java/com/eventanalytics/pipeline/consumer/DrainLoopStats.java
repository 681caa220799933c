package com.eventanalytics.pipeline.consumer;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DrainLoopStats(
        @JsonProperty("queue_length") long queueLength,
        @JsonProperty("pending_count") long pendingCount,
        @JsonProperty("is_running") boolean running
) {}
