package com.eventanalytics.pipeline.metrics;

/**
 * Lightweight metrics API used by the ingestion path and the drain loop, exposed via /metrics.
 */
public interface Metrics {

    void onEventAccepted();

    void onEnqueueFailed();

    void onCounterFailed();

    void onBatchClaimed(int entries);

    void onBatchPersisted(int records, int partitions);

    void onBatchWriteFailed(int failedPartitions);

    void onDrainLoopError();

    MetricsSnapshot snapshot();
}
