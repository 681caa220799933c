package com.eventanalytics.pipeline.state;

import com.eventanalytics.pipeline.model.EventType;
import com.eventanalytics.pipeline.testutil.TestFactory;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

public class MinuteBucketKeyTest {

    @Test
    void testKeyUsesUtcMinuteFloor() {
        assertThat(MinuteBucketKey.of(EventType.PAGE_VIEW, Instant.parse("2024-01-15T14:05:59.999Z")))
                .isEqualTo("page_view_2024-01-15_14:05");
        assertThat(MinuteBucketKey.of(EventType.PAGE_VIEW, Instant.parse("2024-01-15T14:06:00Z")))
                .isEqualTo("page_view_2024-01-15_14:06");
    }

    @Test
    void testKeyOfEventUsesEventTimestamp() {
        String key = MinuteBucketKey.of(TestFactory.pageView("u1", Instant.parse("2024-12-31T23:59:30Z")));

        assertThat(key).isEqualTo("page_view_2024-12-31_23:59");
        assertThat(MinuteBucketKey.usersKey(key)).isEqualTo("page_view_2024-12-31_23:59:users");
    }

    @Test
    void testMinuteStart() {
        assertThat(MinuteBucketKey.minuteStart(Instant.parse("2024-01-15T14:05:42.123Z")))
                .isEqualTo(Instant.parse("2024-01-15T14:05:00Z"));
    }
}
