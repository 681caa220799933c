package com.eventanalytics.pipeline.queue;

import com.eventanalytics.pipeline.exception.FatalConfigException;
import com.eventanalytics.pipeline.exception.TransientStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessage;
import org.springframework.data.redis.connection.stream.PendingMessages;
import org.springframework.data.redis.connection.stream.PendingMessagesSummary;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Event queue on a Redis Stream with a consumer group.
 * <p>
 * {@code XADD} appends, {@code XREADGROUP ... >} claims new entries, {@code XACK}
 * acknowledges. Entries left pending longer than the lease timeout are taken over with
 * {@code XCLAIM} before any new entry is read, so a batch that was never acknowledged
 * (failed write, crashed consumer) is delivered again.
 * <p>
 * The client command timeout also bounds blocking reads, and a {@code XREADGROUP} the client
 * gave up on still moves entries into this consumer's pending list. The command timeout must
 * therefore exceed the drain loop's max wait, and {@code BLOCK} never exceeds that max wait.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "pipeline.queue.backend", havingValue = "redis", matchIfMissing = true)
public class RedisStreamEventQueue implements EventQueue {

    private final StringRedisTemplate redisTemplate;
    private final String streamKey;
    private final String consumerGroup;
    private final Duration leaseTimeout;
    private final Duration maxBlock;

    /**
     * @throws FatalConfigException if {@code commandTimeout} is not greater than {@code maxWaitMs}
     */
    public RedisStreamEventQueue(
            StringRedisTemplate redisTemplate,
            @Value("${pipeline.queue.stream:events_persistent_stream}") String streamKey,
            @Value("${pipeline.queue.consumer-group:persistent_processors}") String consumerGroup,
            @Value("${pipeline.queue.lease-timeout-ms:30000}") long leaseTimeoutMs,
            @Value("${spring.data.redis.timeout:60s}") Duration commandTimeout,
            @Value("${pipeline.drain.max-wait-ms:5000}") long maxWaitMs
    ) {
        if (commandTimeout.compareTo(Duration.ofMillis(maxWaitMs)) <= 0) {
            throw new FatalConfigException("Redis command timeout " + commandTimeout.toMillis()
                    + " ms must be greater than the drain max wait " + maxWaitMs + " ms", null);
        }
        this.redisTemplate = redisTemplate;
        this.streamKey = streamKey;
        this.consumerGroup = consumerGroup;
        this.leaseTimeout = Duration.ofMillis(leaseTimeoutMs);
        this.maxBlock = Duration.ofMillis(maxWaitMs);
    }

    /**
     * Create the consumer group (and the stream, if missing) reading from the start of the stream.
     */
    @Override
    public void prepare() {
        byte[] rawKey = streamKey.getBytes(StandardCharsets.UTF_8);
        try {
            redisTemplate.execute((RedisCallback<String>) connection -> createGroup(connection, rawKey));
            log.info("Created consumer group {} on stream {}", consumerGroup, streamKey);
        } catch (DataAccessException e) {
            if (!isBusyGroup(e)) {
                throw new TransientStoreException("Failed to create consumer group " + consumerGroup, e);
            }
            log.debug("Consumer group {} already exists on stream {}", consumerGroup, streamKey);
        }
    }

    @Override
    public String enqueue(Map<String, String> fields) {
        try {
            RecordId id = redisTemplate.opsForStream()
                    .add(StreamRecords.string(fields).withStreamKey(streamKey));
            if (id == null) {
                throw new TransientStoreException("XADD to " + streamKey + " returned no id", null);
            }
            return id.getValue();
        } catch (DataAccessException e) {
            throw new TransientStoreException("Failed to enqueue entry on " + streamKey, e);
        }
    }

    @Override
    public List<QueueEntry> claim(String consumerId, int maxCount, Duration maxWait) {
        try {
            StreamOperations<String, Object, Object> ops = redisTemplate.opsForStream();

            List<QueueEntry> reclaimed = reclaimStale(ops, consumerId, maxCount);
            if (!reclaimed.isEmpty()) {
                return reclaimed;
            }

            // BLOCK 0 would wait forever
            StreamReadOptions options = StreamReadOptions.empty().count(maxCount);
            if (!maxWait.isZero() && !maxWait.isNegative()) {
                options = options.block(maxWait.compareTo(maxBlock) > 0 ? maxBlock : maxWait);
            }
            List<MapRecord<String, Object, Object>> records = ops.read(
                    Consumer.from(consumerGroup, consumerId),
                    options,
                    StreamOffset.create(streamKey, ReadOffset.lastConsumed())
            );
            return toEntries(records);
        } catch (DataAccessException e) {
            throw new TransientStoreException("Failed to claim entries from " + streamKey, e);
        }
    }

    @Override
    public void acknowledge(List<String> entryIds) {
        if (entryIds.isEmpty()) {
            return;
        }
        try {
            Long acknowledged = redisTemplate.opsForStream()
                    .acknowledge(streamKey, consumerGroup, entryIds.toArray(new String[0]));
            log.debug("Acknowledged {} of {} entries on {}", acknowledged, entryIds.size(), streamKey);
        } catch (DataAccessException e) {
            throw new TransientStoreException("Failed to acknowledge entries on " + streamKey, e);
        }
    }

    @Override
    public QueueStats stats() {
        try {
            StreamOperations<String, Object, Object> ops = redisTemplate.opsForStream();
            Long length = ops.size(streamKey);
            PendingMessagesSummary summary = ops.pending(streamKey, consumerGroup);
            return new QueueStats(
                    length != null ? length : 0L,
                    summary != null ? summary.getTotalPendingMessages() : 0L
            );
        } catch (DataAccessException e) {
            throw new TransientStoreException("Failed to read stats of " + streamKey, e);
        }
    }

    private List<QueueEntry> reclaimStale(StreamOperations<String, Object, Object> ops,
                                          String consumerId, int maxCount) {
        PendingMessages pending = ops.pending(streamKey, consumerGroup, Range.unbounded(), maxCount);
        if (pending == null || pending.isEmpty()) {
            return List.of();
        }
        RecordId[] stale = pending.stream()
                .filter(message -> message.getElapsedTimeSinceLastDelivery().compareTo(leaseTimeout) >= 0)
                .map(PendingMessage::getId)
                .toArray(RecordId[]::new);
        if (stale.length == 0) {
            return List.of();
        }
        List<QueueEntry> reclaimed = toEntries(ops.claim(streamKey, consumerGroup, consumerId, leaseTimeout, stale));
        log.info("Reclaimed {} entries pending for over {} ms on {}",
                reclaimed.size(), leaseTimeout.toMillis(), streamKey);
        return reclaimed;
    }

    private String createGroup(RedisConnection connection, byte[] rawKey) {
        return connection.streamCommands().xGroupCreate(rawKey, consumerGroup, ReadOffset.from("0"), true);
    }

    private static List<QueueEntry> toEntries(List<MapRecord<String, Object, Object>> records) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        List<QueueEntry> entries = new ArrayList<>(records.size());
        // XCLAIM yields null for entries deleted from the stream meanwhile
        for (MapRecord<String, Object, Object> record : records) {
            if (record == null) {
                continue;
            }
            Map<String, String> fields = new LinkedHashMap<>();
            record.getValue().forEach((key, value) ->
                    fields.put(String.valueOf(key), Objects.toString(value, "")));
            entries.add(new QueueEntry(record.getId().getValue(), fields));
        }
        return entries;
    }

    private static boolean isBusyGroup(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t.getMessage() != null && t.getMessage().contains("BUSYGROUP")) {
                return true;
            }
        }
        return false;
    }
}
