package com.eventanalytics.pipeline.queue;

/**
 * @param length  entries retained by the queue
 * @param pending entries delivered to a consumer and not yet acknowledged
 */
public record QueueStats(long length, long pending) {
}
