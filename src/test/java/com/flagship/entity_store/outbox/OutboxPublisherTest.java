package com.flagship.entity_store.outbox;

import com.flagship.entity_store.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Relay loop against a mocked broker: ordering per entity, failure bookkeeping and
 * dead-lettering.
 */
class OutboxPublisherTest {

    private static final String TOPIC = "entity-events";

    private OutboxService outboxService;
    private KafkaTemplate<String, String> kafkaTemplate;
    private OutboxMetrics outboxMetrics;
    private OutboxPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        outboxService = mock(OutboxService.class);
        kafkaTemplate = mock(KafkaTemplate.class);
        outboxMetrics = mock(OutboxMetrics.class);
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "entityEventsTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 3);
    }

    @Test
    @DisplayName("Messages are sent keyed by entity id and marked published")
    void publishesKeyedByEntity() {
        UUID entityId = UUID.randomUUID();
        OutboxEvent created = event(entityId, "Created", 1L, 0);
        when(outboxService.findUnpublishedEvents(100, 3)).thenReturn(List.of(created));
        when(kafkaTemplate.send(TOPIC, entityId.toString(), created.getPayload())).thenReturn(sent(created));

        publisher.triggerPublish();

        verify(outboxService).markPublished(created.getId());
        verify(outboxMetrics).recordEventPublished("Created");
    }

    @Test
    @DisplayName("A failed send holds back later messages of the same entity only")
    void failureHoldsBackSameEntity() {
        UUID failing = UUID.randomUUID();
        UUID healthy = UUID.randomUUID();
        OutboxEvent first = event(failing, "Created", 1L, 0);
        OutboxEvent second = event(failing, "Updated", 2L, 0);
        OutboxEvent other = event(healthy, "Created", 3L, 0);
        when(outboxService.findUnpublishedEvents(100, 3)).thenReturn(List.of(first, second, other));
        when(kafkaTemplate.send(TOPIC, failing.toString(), first.getPayload()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));
        when(kafkaTemplate.send(TOPIC, healthy.toString(), other.getPayload())).thenReturn(sent(other));

        publisher.triggerPublish();

        verify(outboxService).markFailed(eq(first.getId()), anyString());
        verify(kafkaTemplate, never()).send(TOPIC, failing.toString(), second.getPayload());
        verify(outboxService, never()).markPublished(second.getId());
        verify(outboxService).markPublished(other.getId());
    }

    @Test
    @DisplayName("The last allowed failure dead-letters the message")
    void lastFailureDeadLetters() {
        UUID entityId = UUID.randomUUID();
        OutboxEvent retried = event(entityId, "Updated", 1L, 2);
        when(outboxService.findUnpublishedEvents(100, 3)).thenReturn(List.of(retried));
        when(kafkaTemplate.send(TOPIC, entityId.toString(), retried.getPayload()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));

        publisher.triggerPublish();

        verify(outboxMetrics).recordEventPublishFailed("Updated");
        verify(outboxMetrics).recordEventDeadLettered("Updated");
    }

    @Test
    @DisplayName("An empty outbox sends nothing")
    void emptyOutbox() {
        when(outboxService.findUnpublishedEvents(100, 3)).thenReturn(List.of());

        publisher.triggerPublish();

        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }

    private static OutboxEvent event(UUID entityId, String eventType, Long sequenceNumber, int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), "contact", entityId, eventType,
            "{\"eventType\":\"" + eventType + "\"}", Instant.now(), null, retryCount, null, sequenceNumber);
    }

    private static CompletableFuture<SendResult<String, String>> sent(OutboxEvent event) {
        ProducerRecord<String, String> record =
            new ProducerRecord<>(TOPIC, event.getEntityId().toString(), event.getPayload());
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }
}
