package com.eventanalytics.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Represents a page view event accepted at the ingestion boundary.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageViewEvent {

    @NotNull
    @JsonProperty("event_id")
    private UUID eventId;

    @NotBlank
    @Size(max = 255)
    @Pattern(regexp = "^[a-zA-Z0-9_.-]+$",
            message = "can only contain alphanumeric characters, underscore, hyphen, and dot")
    @JsonProperty("user_id")
    private String userId;

    @NotNull
    @JsonProperty("timestamp")
    private Instant timestamp;

    @NotNull
    @JsonProperty("event_type")
    private EventType eventType;

    @Valid
    @JsonProperty("payload")
    private PageViewPayload payload;
}
