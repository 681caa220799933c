package com.eventanalytics.pipeline.state;

import java.util.Set;

/**
 * Per-minute event counts with the distinct users seen in each minute.
 * <p>
 * A bucket and its user set expire together, a fixed time after the bucket's first
 * increment. Later increments never extend the window.
 */
public interface MinuteBucketCounter {

    /**
     * Count one event for the bucket and record its user.
     *
     * @return the bucket count after this increment
     * @throws com.eventanalytics.pipeline.exception.TransientStoreException if the store is unreachable
     */
    long increment(String bucketKey, String userId);

    /**
     * @return the bucket count, 0 for a missing or expired bucket
     */
    long getCount(String bucketKey);

    /**
     * @return the distinct users of the bucket, empty for a missing or expired bucket
     */
    Set<String> getUsers(String bucketKey);
}
