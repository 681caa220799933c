package com.eventanalytics.pipeline.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process queue with the same claim / acknowledge / lease contract as the durable backends.
 * <p>
 * Not durable: entries live as long as the process. Acknowledged entries are dropped.
 * Pending entries whose lease is older than the lease timeout are handed out again on the
 * next claim, ahead of new entries.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "pipeline.queue.backend", havingValue = "memory")
public class InMemoryEventQueue implements EventQueue {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition appended = lock.newCondition();

    // entryId -> fields, in enqueue order
    private final Map<String, Map<String, String>> entries = new LinkedHashMap<>();
    private final Deque<String> undelivered = new ArrayDeque<>();
    // entryId -> lease, in first-claim order
    private final Map<String, Lease> pending = new LinkedHashMap<>();

    private final Clock clock;
    private final Duration leaseTimeout;
    private long sequence;

    public InMemoryEventQueue(
            Clock clock,
            @Value("${pipeline.queue.lease-timeout-ms:30000}") long leaseTimeoutMs
    ) {
        this.clock = clock;
        this.leaseTimeout = Duration.ofMillis(leaseTimeoutMs);
        log.info("Initialized in-memory event queue with lease timeout {} ms", leaseTimeoutMs);
    }

    @Override
    public String enqueue(Map<String, String> fields) {
        lock.lock();
        try {
            String entryId = clock.millis() + "-" + sequence++;
            entries.put(entryId, new LinkedHashMap<>(fields));
            undelivered.addLast(entryId);
            appended.signalAll();
            return entryId;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<QueueEntry> claim(String consumerId, int maxCount, Duration maxWait) {
        long remainingNanos = maxWait.toNanos();
        List<QueueEntry> claimed = new ArrayList<>();
        lock.lock();
        try {
            while (true) {
                reclaimExpiredLeases(consumerId, maxCount, claimed);
                claimUndelivered(consumerId, maxCount, claimed);
                if (!claimed.isEmpty() || remainingNanos <= 0) {
                    return claimed;
                }
                remainingNanos = appended.awaitNanos(remainingNanos);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return claimed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void acknowledge(List<String> entryIds) {
        lock.lock();
        try {
            for (String entryId : entryIds) {
                if (pending.remove(entryId) != null) {
                    entries.remove(entryId);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public QueueStats stats() {
        lock.lock();
        try {
            return new QueueStats(entries.size(), pending.size());
        } finally {
            lock.unlock();
        }
    }

    private void reclaimExpiredLeases(String consumerId, int maxCount, List<QueueEntry> claimed) {
        Instant now = clock.instant();
        for (Map.Entry<String, Lease> entry : pending.entrySet()) {
            if (claimed.size() >= maxCount) {
                return;
            }
            Lease lease = entry.getValue();
            if (Duration.between(lease.claimedAt(), now).compareTo(leaseTimeout) >= 0) {
                entry.setValue(new Lease(consumerId, now, lease.deliveries() + 1));
                claimed.add(new QueueEntry(entry.getKey(), entries.get(entry.getKey())));
                log.debug("Redelivering entry {} to {} (previous owner {}, delivery {})",
                        entry.getKey(), consumerId, lease.consumerId(), lease.deliveries() + 1);
            }
        }
    }

    private void claimUndelivered(String consumerId, int maxCount, List<QueueEntry> claimed) {
        Instant now = clock.instant();
        while (claimed.size() < maxCount && !undelivered.isEmpty()) {
            String entryId = undelivered.pollFirst();
            pending.put(entryId, new Lease(consumerId, now, 1));
            claimed.add(new QueueEntry(entryId, entries.get(entryId)));
        }
    }

    private record Lease(String consumerId, Instant claimedAt, int deliveries) {
    }
}
