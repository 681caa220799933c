package com.eventanalytics.pipeline.api;

import com.eventanalytics.pipeline.engine.PageViewIngestService;
import com.eventanalytics.pipeline.model.PageViewEvent;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ingestion endpoint. Answers as soon as the event is validated; counting and queueing
 * happen on the ingest executor.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class EventController {

    static final String ACCEPTED_MESSAGE = "Page view event accepted and queued for processing";

    private final PageViewIngestService ingestService;

    @PostMapping("/events")
    @ResponseStatus(HttpStatus.CREATED)
    public EventResponse ingest(@Valid @RequestBody PageViewEvent event) {
        ingestService.submit(event);
        log.info("Event {} accepted and queued for background processing", event.getEventId());
        return new EventResponse(true, ACCEPTED_MESSAGE, event.getEventId());
    }
}
