package com.eventanalytics.pipeline.engine;

import com.eventanalytics.pipeline.metrics.Metrics;
import com.eventanalytics.pipeline.model.PageViewEvent;
import com.eventanalytics.pipeline.queue.EventQueue;
import com.eventanalytics.pipeline.queue.PageViewEventCodec;
import com.eventanalytics.pipeline.state.MinuteBucketCounter;
import com.eventanalytics.pipeline.state.MinuteBucketKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Processes accepted page views: counts them in their minute bucket and queues them for
 * persistence.
 *
 * Both writes are best-effort and independent of each other. A failing counter never keeps
 * an event out of the queue, and a failing queue is reported to the caller but never thrown.
 */
@Slf4j
@Service
public class PageViewIngestService {

    private final MinuteBucketCounter counter;
    private final EventQueue queue;
    private final PageViewEventCodec codec;
    private final Metrics metrics;
    private final Clock clock;
    private final TaskExecutor ingestExecutor;

    public PageViewIngestService(
            MinuteBucketCounter counter,
            EventQueue queue,
            PageViewEventCodec codec,
            Metrics metrics,
            Clock clock,
            @Qualifier("ingestExecutor") TaskExecutor ingestExecutor
    ) {
        this.counter = counter;
        this.queue = queue;
        this.codec = codec;
        this.metrics = metrics;
        this.clock = clock;
        this.ingestExecutor = ingestExecutor;
    }

    /**
     * Hand an accepted event to the ingest executor and return without waiting for it.
     */
    public void submit(PageViewEvent event) {
        metrics.onEventAccepted();
        ingestExecutor.execute(() -> process(event));
    }

    public IngestResult process(PageViewEvent event) {
        log.debug("Processing page_view event {} for user {}", event.getEventId(), event.getUserId());
        Long count = countEvent(event);
        boolean queued = enqueue(event);
        return new IngestResult(queued, count);
    }

    /**
     * Queue the event for persistence.
     *
     * @return false if the queue rejected or could not be reached
     */
    public boolean enqueue(PageViewEvent event) {
        try {
            String entryId = queue.enqueue(codec.encode(event, clock.instant()));
            log.debug("Queued event {} as entry {}", event.getEventId(), entryId);
            return true;
        } catch (RuntimeException e) {
            metrics.onEnqueueFailed();
            log.error("Failed to queue event {}", event.getEventId(), e);
            return false;
        }
    }

    /**
     * Count the event in its minute bucket.
     *
     * @return the new bucket count, or null if the counter store failed
     */
    public Long countEvent(PageViewEvent event) {
        String bucketKey = MinuteBucketKey.of(event);
        try {
            long count = counter.increment(bucketKey, event.getUserId());
            log.debug("Updated minute bucket {} to count {}", bucketKey, count);
            return count;
        } catch (RuntimeException e) {
            metrics.onCounterFailed();
            log.warn("Failed to update minute bucket {}, event {} still processed: {}",
                    bucketKey, event.getEventId(), e.getMessage());
            return null;
        }
    }
}
