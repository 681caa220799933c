package com.eventanalytics.pipeline.state;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process minute bucket counter.
 * <p>
 * Each bucket is created and updated inside {@link ConcurrentMap#compute}, which runs
 * atomically per key: two first writes racing on the same key produce one bucket with
 * count 2, never two buckets with count 1. The expiry is fixed when the bucket is created.
 * <p>
 * Expired buckets are invisible to reads straight away and are removed by a periodic sweep.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "pipeline.counter.backend", havingValue = "memory")
public class InMemoryMinuteBucketCounter implements MinuteBucketCounter {

    private final ConcurrentMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    private final Clock clock;
    private final Duration ttl;

    public InMemoryMinuteBucketCounter(
            Clock clock,
            @Value("${pipeline.counter.ttl-seconds:300}") long ttlSeconds
    ) {
        this.clock = clock;
        this.ttl = Duration.ofSeconds(ttlSeconds);
        log.info("Initialized in-memory minute bucket counter with TTL {}s", ttlSeconds);
    }

    @Override
    public long increment(String bucketKey, String userId) {
        Instant now = clock.instant();
        AtomicLong newCount = new AtomicLong();
        buckets.compute(bucketKey, (key, bucket) -> {
            if (bucket == null || bucket.isExpired(now)) {
                bucket = new Bucket(now.plus(ttl));
            }
            bucket.users.add(userId);
            newCount.set(bucket.count.incrementAndGet());
            return bucket;
        });
        log.debug("Incremented minute bucket {} to count {}", bucketKey, newCount.get());
        return newCount.get();
    }

    @Override
    public long getCount(String bucketKey) {
        Bucket bucket = live(bucketKey);
        return bucket != null ? bucket.count.get() : 0L;
    }

    @Override
    public Set<String> getUsers(String bucketKey) {
        Bucket bucket = live(bucketKey);
        return bucket != null ? Set.copyOf(bucket.users) : Set.of();
    }

    /**
     * Remove buckets whose window has passed.
     *
     * @return number of buckets removed
     */
    @Scheduled(fixedRateString = "${pipeline.counter.sweep-interval-ms:30000}")
    public int evictExpired() {
        Instant now = clock.instant();
        int before = buckets.size();
        // removeIf on a ConcurrentHashMap view only removes an entry still mapped to the tested value
        buckets.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
        int evicted = Math.max(0, before - buckets.size());
        if (evicted > 0) {
            log.debug("Evicted {} expired minute buckets", evicted);
        }
        return evicted;
    }

    public int size() {
        return buckets.size();
    }

    private Bucket live(String bucketKey) {
        Bucket bucket = buckets.get(bucketKey);
        if (bucket == null || bucket.isExpired(clock.instant())) {
            return null;
        }
        return bucket;
    }

    private static final class Bucket {
        final AtomicLong count = new AtomicLong();
        final Set<String> users = ConcurrentHashMap.newKeySet();
        final Instant expiresAt;

        Bucket(Instant expiresAt) {
            this.expiresAt = expiresAt;
        }

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
