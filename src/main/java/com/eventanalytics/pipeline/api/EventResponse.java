package com.eventanalytics.pipeline.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

public record EventResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("message") String message,
        @JsonProperty("event_id") UUID eventId
) {}
