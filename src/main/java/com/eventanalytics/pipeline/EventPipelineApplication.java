package com.eventanalytics.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application for the event analytics pipeline.
 *
 * Accepts page view events over HTTP, keeps short-lived per-minute counts and persists
 * every event to hour-partitioned JSON Lines files through a durable queue.
 */
@Slf4j
@SpringBootApplication
public class EventPipelineApplication {

    public static void main(String[] args) {
        log.info("Starting Event Pipeline Application...");
        SpringApplication.run(EventPipelineApplication.class, args);
        log.info("Event Pipeline Application started successfully");
    }
}
