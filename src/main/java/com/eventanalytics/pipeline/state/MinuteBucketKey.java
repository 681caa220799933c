package com.eventanalytics.pipeline.state;

import com.eventanalytics.pipeline.model.EventType;
import com.eventanalytics.pipeline.model.PageViewEvent;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Key space of the minute bucket counter.
 * <p>
 * Events between 10:00:00 and 10:00:59 UTC belong to the "10:00" bucket:
 * {@code page_view_2024-01-15_10:00}. The distinct users of a bucket live under the
 * same key suffixed with {@code :users}.
 */
public final class MinuteBucketKey {

    public static final String USERS_SUFFIX = ":users";

    private static final DateTimeFormatter MINUTE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd_HH:mm").withZone(ZoneOffset.UTC);

    private MinuteBucketKey() {
    }

    public static String of(EventType eventType, Instant timestamp) {
        return eventType.wireName() + "_" + MINUTE_FORMAT.format(timestamp);
    }

    public static String of(PageViewEvent event) {
        return of(event.getEventType(), event.getTimestamp());
    }

    public static String usersKey(String bucketKey) {
        return bucketKey + USERS_SUFFIX;
    }

    public static Instant minuteStart(Instant timestamp) {
        return timestamp.truncatedTo(ChronoUnit.MINUTES);
    }
}
