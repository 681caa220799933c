package com.eventanalytics.pipeline.queue;

import com.eventanalytics.pipeline.exception.FatalConfigException;
import com.eventanalytics.pipeline.exception.TransientStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.RedisSystemException;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessage;
import org.springframework.data.redis.connection.stream.PendingMessages;
import org.springframework.data.redis.connection.stream.PendingMessagesSummary;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisStreamEventQueueTest {

    private static final String STREAM = "events_persistent_stream";
    private static final String GROUP = "persistent_processors";

    private StringRedisTemplate redis;
    private StreamOperations<String, Object, Object> ops;
    private RedisStreamEventQueue queue;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        ops = mock(StreamOperations.class);
        when(redis.<Object, Object>opsForStream()).thenReturn(ops);
        queue = new RedisStreamEventQueue(redis, STREAM, GROUP, 30_000, Duration.ofSeconds(10), 5_000);
    }

    /**
     * A command timeout at or below the max wait would cut every idle blocking read short.
     */
    @Test
    void testCommandTimeoutNotAboveMaxWaitFailsAtStartup() {
        assertThatThrownBy(() -> new RedisStreamEventQueue(redis, STREAM, GROUP, 30_000, Duration.ofSeconds(2), 5_000))
                .isInstanceOf(FatalConfigException.class)
                .hasMessageContaining("5000");
        assertThatThrownBy(() -> new RedisStreamEventQueue(redis, STREAM, GROUP, 30_000, Duration.ofSeconds(5), 5_000))
                .isInstanceOf(FatalConfigException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testBlockingReadWaitsAtMostTheMaxWait() {
        when(ops.pending(eq(STREAM), eq(GROUP), any(Range.class), anyLong()))
                .thenReturn(new PendingMessages(GROUP, List.of()));
        when(ops.read(any(Consumer.class), any(StreamReadOptions.class), any(StreamOffset.class)))
                .thenReturn(List.of());
        ArgumentCaptor<StreamReadOptions> options = ArgumentCaptor.forClass(StreamReadOptions.class);

        queue.claim("c1", 1000, Duration.ofSeconds(5));
        queue.claim("c1", 1000, Duration.ofSeconds(30));

        verify(ops, times(2)).read(any(Consumer.class), options.capture(), any(StreamOffset.class));
        assertThat(options.getAllValues()).extracting(StreamReadOptions::getBlock)
                .containsExactly(5_000L, 5_000L);
        assertThat(options.getAllValues()).extracting(StreamReadOptions::getCount)
                .containsExactly(1000L, 1000L);
    }

    @Test
    void testExistingGroupIsTolerated() {
        when(redis.execute(any(RedisCallback.class))).thenThrow(new RedisSystemException(
                "Error in execution", new RuntimeException("BUSYGROUP Consumer Group name already exists")));

        queue.prepare();
    }

    @Test
    void testGroupCreationFailureIsTransient() {
        when(redis.execute(any(RedisCallback.class)))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThatThrownBy(() -> queue.prepare()).isInstanceOf(TransientStoreException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testClaimReadsNewEntriesWhenNothingIsStale() {
        when(ops.pending(eq(STREAM), eq(GROUP), any(Range.class), anyLong()))
                .thenReturn(new PendingMessages(GROUP, List.of()));
        when(ops.read(any(Consumer.class), any(StreamReadOptions.class), any(StreamOffset.class)))
                .thenReturn(List.of(record("1705327500000-0", "u1"), record("1705327500000-1", "u2")));

        List<QueueEntry> claimed = queue.claim("c1", 100, Duration.ofSeconds(5));

        assertThat(claimed).extracting(QueueEntry::entryId)
                .containsExactly("1705327500000-0", "1705327500000-1");
        assertThat(claimed.get(1).field("user_id")).isEqualTo("u2");
    }

    /**
     * Entries idle past the lease are taken over before any new entry is read.
     */
    @Test
    @SuppressWarnings("unchecked")
    void testStaleEntriesAreReclaimedFirst() {
        RecordId stale = RecordId.of("1705327500000-0");
        RecordId fresh = RecordId.of("1705327530000-0");
        when(ops.pending(eq(STREAM), eq(GROUP), any(Range.class), anyLong()))
                .thenReturn(new PendingMessages(GROUP, List.of(
                        new PendingMessage(stale, Consumer.from(GROUP, "dead"), Duration.ofSeconds(45), 1),
                        new PendingMessage(fresh, Consumer.from(GROUP, "c1"), Duration.ofSeconds(2), 1))));
        when(ops.claim(eq(STREAM), eq(GROUP), eq("c1"), eq(Duration.ofSeconds(30)), any(RecordId[].class)))
                .thenReturn(List.of(record(stale.getValue(), "u1")));

        List<QueueEntry> claimed = queue.claim("c1", 100, Duration.ofSeconds(5));

        assertThat(claimed).extracting(QueueEntry::entryId).containsExactly(stale.getValue());
        verify(ops).claim(STREAM, GROUP, "c1", Duration.ofSeconds(30), stale);
        verify(ops, never()).read(any(Consumer.class), any(StreamReadOptions.class), any(StreamOffset.class));
    }

    @Test
    void testAcknowledgeSendsAllIds() {
        queue.acknowledge(List.of("1-0", "1-1"));

        verify(ops).acknowledge(STREAM, GROUP, "1-0", "1-1");
    }

    @Test
    void testStatsCombineLengthAndPending() {
        when(ops.size(STREAM)).thenReturn(42L);
        when(ops.pending(STREAM, GROUP)).thenReturn(
                new PendingMessagesSummary(GROUP, 7, Range.unbounded(), Map.of("c1", 7L)));

        assertThat(queue.stats()).isEqualTo(new QueueStats(42, 7));
    }

    @Test
    void testUnreachableStoreOnEnqueueIsTransient() {
        when(ops.add(any(MapRecord.class))).thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThatThrownBy(() -> queue.enqueue(Map.of("user_id", "u1")))
                .isInstanceOf(TransientStoreException.class);
    }

    private static MapRecord<String, Object, Object> record(String id, String user) {
        return StreamRecords.newRecord()
                .in(STREAM)
                .withId(RecordId.of(id))
                .ofMap(Map.<Object, Object>of("user_id", user));
    }
}
