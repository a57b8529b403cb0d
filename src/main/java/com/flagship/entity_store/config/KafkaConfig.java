package com.flagship.entity_store.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

/**
 * Topic and listener error handling for the entity event relay.
 *
 * Records are keyed by entity id, so the partition count bounds how many entities the
 * graph mirror can process in parallel.
 */
@Configuration
@Slf4j
public class KafkaConfig {

    @Value("${kafka.topic.entity-events:entity-events}")
    private String entityEventsTopic;

    @Value("${kafka.topic.partitions:6}")
    private int partitions;

    @Value("${kafka.topic.replicas:1}")
    private int replicas;

    @Bean
    @ConditionalOnProperty(name = "kafka.topic.create", havingValue = "true", matchIfMissing = true)
    public NewTopic entityEventsTopic() {
        return TopicBuilder.name(entityEventsTopic)
                .partitions(partitions)
                .replicas(replicas)
                .build();
    }

    /**
     * Redelivers a failed record a few times before logging it and moving on. The
     * record is not in the processed-events table, so replaying the topic applies it.
     */
    @Bean
    public CommonErrorHandler graphMirrorErrorHandler(
            @Value("${consumer.retry.interval-ms:1000}") long intervalMs,
            @Value("${consumer.retry.max-attempts:5}") long maxAttempts) {
        DefaultErrorHandler handler = new DefaultErrorHandler(
            (record, e) -> log.error("Giving up on {}-{}@{} (key={}): {}", record.topic(), record.partition(),
                record.offset(), record.key(), e.getMessage()),
            new FixedBackOff(intervalMs, maxAttempts));
        handler.addNotRetryableExceptions(IllegalArgumentException.class);
        return handler;
    }
}
