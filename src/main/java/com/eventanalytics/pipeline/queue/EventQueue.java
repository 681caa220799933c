package com.eventanalytics.pipeline.queue;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Durable, ordered, append-only queue with consumer-group semantics.
 * <p>
 * Entries handed out by {@link #claim} stay pending until {@link #acknowledge}d. Pending
 * entries that are never acknowledged are delivered again once their lease runs out, so
 * consumers see every entry at least once.
 * <p>
 * Every operation reports an unreachable backend as
 * {@link com.eventanalytics.pipeline.exception.TransientStoreException}.
 */
public interface EventQueue {

    /**
     * Create whatever the consumer side needs before the first claim, e.g. a consumer group.
     * Safe to call more than once.
     */
    default void prepare() {
    }

    /**
     * Append an entry.
     *
     * @param fields flattened scalar fields of the entry
     * @return the id the queue assigned to the entry
     */
    String enqueue(Map<String, String> fields);

    /**
     * Claim up to {@code maxCount} entries for {@code consumerId}, waiting at most
     * {@code maxWait} when none are available.
     *
     * @return claimed entries in queue order, empty when the wait ran out
     */
    List<QueueEntry> claim(String consumerId, int maxCount, Duration maxWait);

    /**
     * Acknowledge claimed entries. Unknown or already acknowledged ids are ignored.
     */
    void acknowledge(List<String> entryIds);

    QueueStats stats();
}
