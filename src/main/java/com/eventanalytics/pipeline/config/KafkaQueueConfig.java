package com.eventanalytics.pipeline.config;

import com.eventanalytics.pipeline.queue.KafkaEventQueue;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.ProducerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Kafka-backed event queue, selected with {@code pipeline.queue.backend=kafka}.
 *
 * Key design decisions:
 * - Manual offset commits, driven by batch acknowledgment
 * - One consumer polled by the drain loop thread, no listener container
 * - Idempotent producer with acks=all so an accepted enqueue survives a broker failover
 */
@Configuration
@ConditionalOnProperty(name = "pipeline.queue.backend", havingValue = "kafka")
public class KafkaQueueConfig {

    @Value("${pipeline.kafka.bootstrap-servers:localhost:29092}")
    private String bootstrapServers;

    @Value("${pipeline.kafka.topic:page_view_events}")
    private String topic;

    @Value("${pipeline.queue.consumer-group:persistent_processors}")
    private String groupId;

    @Value("${pipeline.drain.batch-size:1000}")
    private int batchSize;

    @Value("${pipeline.queue.lease-timeout-ms:30000}")
    private long leaseTimeoutMs;

    @Value("${pipeline.kafka.request-timeout-ms:5000}")
    private long requestTimeoutMs;

    private Map<String, Object> consumerConfigs() {
        Map<String, Object> props = new HashMap<>();

        // Connection
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);

        // Deserialization
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);

        // Offsets are committed only after a batch is persisted
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, batchSize);
        props.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, 300000);
        props.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, (int) leaseTimeoutMs);
        props.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, (int) Math.max(1000, leaseTimeoutMs / 3));

        return props;
    }

    private Map<String, Object> producerConfigs() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, 30000);
        return props;
    }

    @Bean
    public ConsumerFactory<String, String> eventQueueConsumerFactory() {
        return new DefaultKafkaConsumerFactory<>(consumerConfigs());
    }

    @Bean
    public ProducerFactory<String, String> eventQueueProducerFactory() {
        return new DefaultKafkaProducerFactory<>(producerConfigs());
    }

    @Bean(destroyMethod = "close")
    public KafkaEventQueue kafkaEventQueue(ConsumerFactory<String, String> eventQueueConsumerFactory,
                                           ProducerFactory<String, String> eventQueueProducerFactory,
                                           ObjectMapper objectMapper) {
        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        return new KafkaEventQueue(
                eventQueueProducerFactory.createProducer(),
                eventQueueConsumerFactory.createConsumer(),
                Admin.create(adminProps),
                objectMapper,
                topic,
                groupId,
                Duration.ofMillis(requestTimeoutMs)
        );
    }
}
