package com.eventanalytics.pipeline.engine;

/**
 * @param queued      whether the event reached the queue
 * @param bucketCount minute bucket count after this event, null when counting failed
 */
public record IngestResult(boolean queued, Long bucketCount) {
}
