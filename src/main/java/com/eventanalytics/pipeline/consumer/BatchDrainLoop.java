package com.eventanalytics.pipeline.consumer;

import com.eventanalytics.pipeline.exception.PartialBatchWriteException;
import com.eventanalytics.pipeline.metrics.Metrics;
import com.eventanalytics.pipeline.output.BatchWriteResult;
import com.eventanalytics.pipeline.output.PartitionedFileWriter;
import com.eventanalytics.pipeline.queue.EventQueue;
import com.eventanalytics.pipeline.queue.QueueEntry;
import com.eventanalytics.pipeline.queue.QueueStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single consumer that drains the event queue into partition files.
 * <p>
 * Each iteration claims up to {@code batch-size} entries, waiting at most {@code max-wait-ms},
 * writes them with {@link PartitionedFileWriter} and acknowledges the whole batch only once
 * every partition was written. A batch that was not fully written is never acknowledged, so
 * the queue delivers it again after its lease: at-least-once, duplicates possible.
 * <p>
 * Errors never end the loop: they are logged, counted and followed by a fixed backoff.
 * {@link #stop()} is cooperative, the flag is checked between iterations, so stopping
 * takes at most one claim wait plus the write in progress.
 */
@Slf4j
@Component
public class BatchDrainLoop implements SmartLifecycle {

    private final EventQueue queue;
    private final PartitionedFileWriter writer;
    private final Metrics metrics;

    private final String consumerName;
    private final int batchSize;
    private final Duration maxWait;
    private final Duration errorBackoff;
    private final Duration shutdownGrace;
    private final boolean autoStartup;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile CountDownLatch done = new CountDownLatch(0);
    private volatile boolean prepared;

    public BatchDrainLoop(
            EventQueue queue,
            PartitionedFileWriter writer,
            Metrics metrics,
            @Value("${pipeline.queue.consumer-name:persistent_consumer_1}") String consumerName,
            @Value("${pipeline.drain.batch-size:1000}") int batchSize,
            @Value("${pipeline.drain.max-wait-ms:5000}") long maxWaitMs,
            @Value("${pipeline.drain.error-backoff-ms:1000}") long errorBackoffMs,
            @Value("${pipeline.drain.shutdown-grace-ms:10000}") long shutdownGraceMs,
            @Value("${pipeline.drain.auto-start:true}") boolean autoStartup
    ) {
        this.queue = queue;
        this.writer = writer;
        this.metrics = metrics;
        this.consumerName = consumerName;
        this.batchSize = batchSize;
        this.maxWait = Duration.ofMillis(maxWaitMs);
        this.errorBackoff = Duration.ofMillis(errorBackoffMs);
        this.shutdownGrace = Duration.ofMillis(shutdownGraceMs);
        this.autoStartup = autoStartup;
    }

    /**
     * Start the loop thread. A second start while the loop runs (or is still finishing)
     * is ignored: one consumer identity must never be drained twice concurrently.
     *
     * @throws com.eventanalytics.pipeline.exception.FatalConfigException if the storage root
     *         cannot be created; the loop is not started
     */
    @Override
    public void start() {
        if (done.getCount() > 0 || !running.compareAndSet(false, true)) {
            log.warn("Batch drain loop already running");
            return;
        }
        try {
            writer.initialize();
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
        done = new CountDownLatch(1);
        Thread worker = new Thread(this::runLoop, "batch-drain-loop");
        worker.start();
        log.info("Started batch drain loop (consumer={}, batchSize={}, maxWait={} ms)",
                consumerName, batchSize, maxWait.toMillis());
    }

    /**
     * Ask the loop to stop and wait for it to finish its current iteration.
     */
    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping batch drain loop...");
        if (!awaitTermination(maxWait.plus(shutdownGrace))) {
            log.warn("Batch drain loop did not stop within {} ms", maxWait.plus(shutdownGrace).toMillis());
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    /**
     * @return true once the loop thread has exited
     */
    public boolean awaitTermination(Duration timeout) {
        try {
            return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public DrainLoopStats stats() {
        QueueStats queueStats = queue.stats();
        return new DrainLoopStats(queueStats.length(), queueStats.pending(), running.get());
    }

    /**
     * Run one claim / write / acknowledge cycle.
     *
     * @return number of entries persisted and acknowledged
     * @throws PartialBatchWriteException if a partition of the batch could not be written;
     *         nothing was acknowledged
     */
    public int drainOnce() {
        if (!prepared) {
            queue.prepare();
            prepared = true;
        }
        List<QueueEntry> batch = queue.claim(consumerName, batchSize, maxWait);
        if (batch.isEmpty()) {
            return 0;
        }
        metrics.onBatchClaimed(batch.size());

        BatchWriteResult result = writer.writeBatch(batch);
        if (!result.isSuccess()) {
            metrics.onBatchWriteFailed(result.failedPartitions().size());
            throw new PartialBatchWriteException(batch.size(), result.failedPartitions());
        }

        queue.acknowledge(batch.stream().map(QueueEntry::entryId).toList());
        metrics.onBatchPersisted(result.recordsWritten(), result.partitionsWritten());
        log.info("Processed batch of {} events into {} partitions", batch.size(), result.partitionsWritten());
        return batch.size();
    }

    private void runLoop() {
        log.info("Starting batch processing loop...");
        try {
            while (running.get()) {
                try {
                    drainOnce();
                } catch (Exception e) {
                    metrics.onDrainLoopError();
                    log.error("Error in batch processing, retrying in {} ms", errorBackoff.toMillis(), e);
                    if (!backoff()) {
                        break;
                    }
                }
            }
        } finally {
            running.set(false);
            log.info("Batch drain loop stopped");
            done.countDown();
        }
    }

    private boolean backoff() {
        try {
            Thread.sleep(errorBackoff.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Batch drain loop interrupted during backoff");
            return false;
        }
    }
}
