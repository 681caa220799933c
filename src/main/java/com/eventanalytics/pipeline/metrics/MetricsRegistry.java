package com.eventanalytics.pipeline.metrics;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class MetricsRegistry implements Metrics {

    private final AtomicLong eventsAccepted = new AtomicLong();
    private final AtomicLong enqueueFailures = new AtomicLong();
    private final AtomicLong counterFailures = new AtomicLong();

    private final AtomicLong batchesClaimed = new AtomicLong();
    private final AtomicLong entriesClaimed = new AtomicLong();
    private final AtomicLong recordsPersisted = new AtomicLong();
    private final AtomicLong partitionsWritten = new AtomicLong();
    private final AtomicLong batchWriteFailures = new AtomicLong();
    private final AtomicLong drainLoopErrors = new AtomicLong();

    private final AtomicReference<Instant> lastBatchAt = new AtomicReference<>();
    private final AtomicReference<Instant> lastUpdatedAt =
            new AtomicReference<>(Instant.now());

    @Override
    public void onEventAccepted() {
        eventsAccepted.incrementAndGet();
        touch();
    }

    @Override
    public void onEnqueueFailed() {
        enqueueFailures.incrementAndGet();
        touch();
    }

    @Override
    public void onCounterFailed() {
        counterFailures.incrementAndGet();
        touch();
    }

    @Override
    public void onBatchClaimed(int entries) {
        batchesClaimed.incrementAndGet();
        entriesClaimed.addAndGet(entries);
        touch();
    }

    @Override
    public void onBatchPersisted(int records, int partitions) {
        recordsPersisted.addAndGet(records);
        partitionsWritten.addAndGet(partitions);
        lastBatchAt.set(Instant.now());
        touch();
    }

    @Override
    public void onBatchWriteFailed(int failedPartitions) {
        if (failedPartitions <= 0) {
            return;
        }
        batchWriteFailures.incrementAndGet();
        touch();
    }

    @Override
    public void onDrainLoopError() {
        drainLoopErrors.incrementAndGet();
        touch();
    }

    /* ---------- Snapshot ---------- */

    @Override
    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
                eventsAccepted.get(),
                enqueueFailures.get(),
                counterFailures.get(),
                batchesClaimed.get(),
                entriesClaimed.get(),
                recordsPersisted.get(),
                partitionsWritten.get(),
                batchWriteFailures.get(),
                drainLoopErrors.get(),
                lastBatchAt.get(),
                lastUpdatedAt.get()
        );
    }

    private void touch() {
        lastUpdatedAt.set(Instant.now());
    }
}
