package com.eventanalytics.pipeline.queue;

import com.eventanalytics.pipeline.exception.TransientStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.ListOffsetsResult.ListOffsetsResultInfo;
import org.apache.kafka.clients.admin.OffsetSpec;
import org.apache.kafka.clients.admin.TopicDescription;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Event queue on a Kafka topic with manual offset commits.
 * <p>
 * Kafka has no per-record lease, so redelivery works on offsets instead: records handed out
 * by {@link #claim} and not acknowledged before the next claim are rewound (the consumer seeks
 * back to the first unacknowledged offset of each partition) and come back in that claim.
 * The committed offset never moves past an unacknowledged record, so a restart resumes at
 * the first unacknowledged record.
 * <p>
 * {@link #claim} and {@link #acknowledge} must be called from one thread, the drain loop;
 * the consumer is not thread-safe. {@link #enqueue} and {@link #stats} may be called from
 * any thread.
 * <p>
 * Entry ids are {@code <partition>-<offset>}.
 */
@Slf4j
public class KafkaEventQueue implements EventQueue, AutoCloseable {

    private static final TypeReference<LinkedHashMap<String, String>> FIELDS_TYPE = new TypeReference<>() {
    };

    private final Producer<String, String> producer;
    private final Consumer<String, String> consumer;
    private final Admin admin;
    private final ObjectMapper objectMapper;
    private final String topic;
    private final String consumerGroup;
    private final Duration requestTimeout;

    // partition -> offsets claimed and not yet acknowledged
    private final Map<TopicPartition, TreeSet<Long>> inFlight = new HashMap<>();
    // partition -> highest offset handed out since the last rewind
    private final Map<TopicPartition, Long> highestClaimed = new HashMap<>();
    private volatile boolean subscribed;

    public KafkaEventQueue(Producer<String, String> producer,
                           Consumer<String, String> consumer,
                           Admin admin,
                           ObjectMapper objectMapper,
                           String topic,
                           String consumerGroup,
                           Duration requestTimeout) {
        this.producer = producer;
        this.consumer = consumer;
        this.admin = admin;
        this.objectMapper = objectMapper;
        this.topic = topic;
        this.consumerGroup = consumerGroup;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public void prepare() {
        if (!subscribed) {
            consumer.subscribe(List.of(topic));
            subscribed = true;
            log.info("Subscribed consumer group {} to topic {}", consumerGroup, topic);
        }
    }

    @Override
    public String enqueue(Map<String, String> fields) {
        try {
            String value = objectMapper.writeValueAsString(fields);
            RecordMetadata metadata = producer
                    .send(new ProducerRecord<>(topic, fields.get(PageViewEventCodec.EVENT_ID), value))
                    .get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return metadata.partition() + "-" + metadata.offset();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize queue fields", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientStoreException("Interrupted while enqueueing on " + topic, e);
        } catch (ExecutionException | TimeoutException | KafkaException e) {
            throw new TransientStoreException("Failed to enqueue entry on " + topic, e);
        }
    }

    @Override
    public List<QueueEntry> claim(String consumerId, int maxCount, Duration maxWait) {
        try {
            rewindUnacknowledged();
            ConsumerRecords<String, String> records = consumer.poll(maxWait);

            List<QueueEntry> entries = new ArrayList<>();
            Map<TopicPartition, Long> returnToQueue = new HashMap<>();
            for (ConsumerRecord<String, String> record : records) {
                TopicPartition partition = new TopicPartition(record.topic(), record.partition());
                if (entries.size() >= maxCount) {
                    returnToQueue.merge(partition, record.offset(), Math::min);
                    continue;
                }
                entries.add(new QueueEntry(record.partition() + "-" + record.offset(), decodeFields(record)));
                inFlight.computeIfAbsent(partition, p -> new TreeSet<>()).add(record.offset());
                highestClaimed.merge(partition, record.offset(), Math::max);
            }
            returnToQueue.forEach(consumer::seek);
            return entries;
        } catch (KafkaException e) {
            throw new TransientStoreException("Failed to claim entries from " + topic, e);
        }
    }

    @Override
    public void acknowledge(List<String> entryIds) {
        Set<TopicPartition> touched = new HashSet<>();
        for (String entryId : entryIds) {
            int separator = entryId.indexOf('-');
            TopicPartition partition = new TopicPartition(topic, Integer.parseInt(entryId.substring(0, separator)));
            long offset = Long.parseLong(entryId.substring(separator + 1));
            TreeSet<Long> offsets = inFlight.get(partition);
            if (offsets != null && offsets.remove(offset)) {
                touched.add(partition);
            }
        }

        // Commit up to the first offset still in flight, or past everything claimed
        Map<TopicPartition, OffsetAndMetadata> commits = new HashMap<>();
        for (TopicPartition partition : touched) {
            TreeSet<Long> remaining = inFlight.get(partition);
            long next = remaining.isEmpty() ? highestClaimed.get(partition) + 1 : remaining.first();
            commits.put(partition, new OffsetAndMetadata(next));
        }
        if (commits.isEmpty()) {
            return;
        }
        try {
            consumer.commitSync(commits);
            log.debug("Committed offsets {}", commits);
        } catch (KafkaException e) {
            throw new TransientStoreException("Failed to commit offsets on " + topic, e);
        }
    }

    /**
     * length = records retained by the topic, pending = records not yet committed by the group.
     */
    @Override
    public QueueStats stats() {
        try {
            TopicDescription description = admin.describeTopics(List.of(topic))
                    .allTopicNames().get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS).get(topic);
            Map<TopicPartition, OffsetSpec> latest = new HashMap<>();
            Map<TopicPartition, OffsetSpec> earliest = new HashMap<>();
            description.partitions().forEach(info -> {
                TopicPartition partition = new TopicPartition(topic, info.partition());
                latest.put(partition, OffsetSpec.latest());
                earliest.put(partition, OffsetSpec.earliest());
            });

            Map<TopicPartition, ListOffsetsResultInfo> ends = admin.listOffsets(latest)
                    .all().get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
            Map<TopicPartition, ListOffsetsResultInfo> starts = admin.listOffsets(earliest)
                    .all().get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
            Map<TopicPartition, OffsetAndMetadata> committed = admin.listConsumerGroupOffsets(consumerGroup)
                    .partitionsToOffsetAndMetadata().get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);

            long length = 0;
            long pending = 0;
            for (Map.Entry<TopicPartition, ListOffsetsResultInfo> end : ends.entrySet()) {
                long start = starts.get(end.getKey()).offset();
                OffsetAndMetadata commit = committed.get(end.getKey());
                long consumed = commit != null ? commit.offset() : start;
                length += end.getValue().offset() - start;
                pending += end.getValue().offset() - consumed;
            }
            return new QueueStats(length, pending);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientStoreException("Interrupted while reading stats of " + topic, e);
        } catch (ExecutionException | TimeoutException | KafkaException e) {
            throw new TransientStoreException("Failed to read stats of " + topic, e);
        }
    }

    @Override
    public void close() {
        try {
            consumer.close();
            producer.close();
            admin.close();
            log.info("Kafka event queue on {} closed", topic);
        } catch (KafkaException e) {
            log.error("Error closing Kafka event queue on {}", topic, e);
        }
    }

    private void rewindUnacknowledged() {
        inFlight.forEach((partition, offsets) -> {
            if (!offsets.isEmpty() && consumer.assignment().contains(partition)) {
                log.info("Rewinding {} to offset {} for {} unacknowledged records",
                        partition, offsets.first(), offsets.size());
                consumer.seek(partition, offsets.first());
            }
        });
        inFlight.clear();
        highestClaimed.clear();
    }

    private Map<String, String> decodeFields(ConsumerRecord<String, String> record) {
        if (record.value() != null) {
            try {
                return objectMapper.readValue(record.value(), FIELDS_TYPE);
            } catch (JsonProcessingException e) {
                log.debug("Cannot parse record {}-{}: {}", record.partition(), record.offset(), e.getOriginalMessage());
            }
        }
        log.warn("Record {}-{} on {} is not a field map, keeping only its broker timestamp",
                record.partition(), record.offset(), topic);
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(PageViewEventCodec.QUEUED_AT, Instant.ofEpochMilli(record.timestamp()).toString());
        return fields;
    }
}
