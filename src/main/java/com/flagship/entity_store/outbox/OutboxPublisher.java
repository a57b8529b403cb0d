package com.flagship.entity_store.outbox;

import com.flagship.entity_store.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;

/**
 * Relays committed entity events from the outbox to the graph mirror topic.
 *
 * The entity id is the record key, so one entity's events land on one partition in
 * commit order. Sends are synchronous. When a send fails, the remaining messages of
 * that entity in the batch are held back so the mirror never sees them out of order.
 * Messages past the retry limit are dead-lettered and need manual attention.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.entity-events:entity-events}")
    private String entityEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.findUnpublishedEvents(batchSize, maxRetries);
        } catch (RuntimeException e) {
            log.error("Could not claim outbox messages, retrying on the next poll", e);
            return;
        }
        if (batch.isEmpty()) {
            return;
        }
        log.debug("Relaying {} outbox messages", batch.size());

        Set<UUID> heldBack = new HashSet<>();
        int relayed = 0;
        for (OutboxEvent event : batch) {
            if (heldBack.contains(event.getEntityId())) {
                continue;
            }
            if (relay(event)) {
                relayed++;
            } else {
                heldBack.add(event.getEntityId());
            }
        }
        if (!heldBack.isEmpty()) {
            log.info("Relayed {}/{} outbox messages, {} entities held back", relayed, batch.size(), heldBack.size());
        }
    }

    private boolean relay(OutboxEvent event) {
        try {
            SendResult<String, String> result = kafkaTemplate
                .send(entityEventsTopic, event.getEntityId().toString(), event.getPayload())
                .get();
            log.debug("Relayed {} of {}:{} to {}-{}@{}", event.getEventType(), event.getEntityType(),
                event.getEntityId(), result.getRecordMetadata().topic(), result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset());
            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "interrupted");
            return false;
        } catch (Exception e) {
            String error = e instanceof ExecutionException && e.getCause() != null
                ? e.getCause().getMessage() : e.getMessage();
            log.error("Relay of {} for {}:{} failed: {}", event.getEventType(), event.getEntityType(),
                event.getEntityId(), error);
            outboxService.markFailed(event.getId(), error);
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Outbox message {} ({} of {}:{}) dead-lettered after {} attempts", event.getId(),
                    event.getEventType(), event.getEntityType(), event.getEntityId(), maxRetries);
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
            return false;
        }
    }

    public void triggerPublish() {
        publishPendingEvents();
    }
}
