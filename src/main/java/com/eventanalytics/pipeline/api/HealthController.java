package com.eventanalytics.pipeline.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

/**
 * Liveness and the API index. Store connectivity is reported by {@code /persistent/status}.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    static final String SERVICE_NAME = "event-analytics";
    static final String API_VERSION = "1.0.0";

    private final Clock clock;

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("healthy", clock.instant(), SERVICE_NAME);
    }

    @GetMapping("/")
    public ApiInfoResponse root() {
        return new ApiInfoResponse(
                "Welcome to Event Analytics API",
                API_VERSION,
                "/health",
                "/events",
                "/analytics",
                "/persistent",
                "/metrics"
        );
    }

    public record ApiInfoResponse(
            @JsonProperty("message") String message,
            @JsonProperty("version") String version,
            @JsonProperty("health") String health,
            @JsonProperty("events") String events,
            @JsonProperty("analytics") String analytics,
            @JsonProperty("persistent") String persistent,
            @JsonProperty("metrics") String metrics
    ) {}

    public record HealthResponse(
            @JsonProperty("status") String status,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("service") String service
    ) {}
}
