package com.flagship.entity_store.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.entity_store.observability.CorrelationContext;
import com.flagship.entity_store.outbox.EntityEventMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Kafka listener feeding committed entity events to the graph mirror.
 *
 * Delivery is at least once: the offset is acknowledged only after the event was
 * applied (or recognized as already applied). A failing message is not acknowledged
 * and comes back through the container's error handler.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class GraphMirrorConsumer {

    private final IdempotentEventProcessor eventProcessor;
    private final GraphMirrorEventHandler eventHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.entity-events:entity-events}",
        groupId = "${spring.kafka.consumer.group-id:entity-store-graph-mirror}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
            record.topic(), record.partition(), record.offset(), record.key());

        EntityEventMessage message = parse(record.value());
        if (message == null) {
            log.warn("Could not parse message at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        try (MDC.MDCCloseable ignored = MDC.putCloseable(CorrelationContext.ENTITY_REF_MDC_KEY,
                message.getEntityType() + ":" + message.getEntityId())) {
            if (!eventHandler.handles(message)) {
                eventProcessor.skipEvent(message.getEventId(), message.getEventType(), message.getEntityType(),
                    message.getEntityId(), "Not mirrored");
                ack.acknowledge();
                return;
            }

            boolean processed = eventProcessor.processEvent(message.getEventId(), message.getEventType(),
                message.getEntityType(), message.getEntityId(), () -> eventHandler.handle(message));
            ack.acknowledge();

            if (processed) {
                log.info("Mirrored {} #{} (eventId={})", message.getEventType(), message.getSequence(),
                    message.getEventId());
            }
        }
    }

    private EntityEventMessage parse(String json) {
        try {
            EntityEventMessage message = objectMapper.readValue(json, EntityEventMessage.class);
            if (message.getEventId() == null || message.getEntityId() == null
                    || message.getEntityType() == null || message.getEventType() == null) {
                log.error("Message is missing envelope fields: {}", json);
                return null;
            }
            return message;
        } catch (JsonProcessingException e) {
            log.error("Failed to parse message: {}", e.getMessage());
            return null;
        }
    }
}
