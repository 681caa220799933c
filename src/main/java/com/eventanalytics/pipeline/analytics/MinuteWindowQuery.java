package com.eventanalytics.pipeline.analytics;

import com.eventanalytics.pipeline.model.EventType;
import com.eventanalytics.pipeline.state.MinuteBucketCounter;
import com.eventanalytics.pipeline.state.MinuteBucketKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view over the minute bucket counter.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MinuteWindowQuery {

    private static final DateTimeFormatter MINUTE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private final MinuteBucketCounter counter;
    private final Clock clock;

    /**
     * One entry per minute from the minute containing {@code from} up to {@code to}, inclusive.
     * Minutes without events (or already expired) report 0.
     */
    public List<MinuteCount> countsBetween(Instant from, Instant to) {
        List<MinuteCount> result = new ArrayList<>();
        for (Instant minute = MinuteBucketKey.minuteStart(from);
             !minute.isAfter(to);
             minute = minute.plus(Duration.ofMinutes(1))) {
            String bucketKey = MinuteBucketKey.of(EventType.PAGE_VIEW, minute);
            result.add(new MinuteCount(
                    MINUTE_TIMESTAMP.format(minute),
                    bucketKey,
                    counter.getCount(bucketKey),
                    counter.getUsers(bucketKey).size()
            ));
        }
        return result;
    }

    /**
     * Counts of the last {@code minutes} minutes, up to now.
     */
    public List<MinuteCount> recentMinutes(int minutes) {
        Instant now = clock.instant();
        List<MinuteCount> counts = countsBetween(now.minus(Duration.ofMinutes(minutes)), now);
        log.debug("Retrieved page views per minute for last {} minutes: {} entries", minutes, counts.size());
        return counts;
    }

    public long bucketCount(String bucketKey) {
        return counter.getCount(bucketKey);
    }
}
