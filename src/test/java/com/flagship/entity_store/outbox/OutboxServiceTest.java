package com.flagship.entity_store.outbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.entity_store.EntityStoreTestSupport;
import com.flagship.entity_store.entity.EntityRef;
import com.flagship.entity_store.event.EventLog;
import com.flagship.entity_store.event.StoredEvent;
import com.flagship.entity_store.merge.MatchCandidate;
import com.flagship.entity_store.merge.MergeCoordinator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Relay messages are written with the events they describe and drained in order.
 */
class OutboxServiceTest extends EntityStoreTestSupport {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private EventLog eventLog;

    @Autowired
    private MergeCoordinator mergeCoordinator;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("A created entity queues a message carrying the stored event")
    void createQueuesMessage() throws Exception {
        EntityRef ref = createContact("Ada", "Lovelace");
        StoredEvent created = eventLog.readAll(ref).get(0);

        List<OutboxEvent> events = outboxService.getEventsForEntity(ref);

        assertEquals(1, events.size());
        OutboxEvent outbox = events.get(0);
        assertEquals("Created", outbox.getEventType());
        assertFalse(outbox.isPublished());

        EntityEventMessage message = objectMapper.readValue(outbox.getPayload(), EntityEventMessage.class);
        assertEquals(created.getId(), message.getEventId());
        assertEquals(1, message.getSequence());
        assertEquals("contact", message.getEntityType());
        assertEquals("Ada", message.getPayload().path("fields").path("first_name").asText());
        assertFalse(message.isErased());
    }

    @Test
    @DisplayName("A merge queues one message per side in the same commit")
    void mergeQueuesBothSides() throws Exception {
        EntityRef a = createContact("Ada", "Lovelace");
        EntityRef b = createContact("Bea", "Byron");
        MatchCandidate candidate = mergeCoordinator.submit(a, b, 0.7, Map.of(), "matcher");
        mergeCoordinator.approve(candidate.getId(), a.id(), "reviewer", Map.of());

        List<OutboxEvent> forB = outboxService.getEventsForEntity(b);
        assertEquals(List.of("Created", "Merged"), forB.stream().map(OutboxEvent::getEventType).toList());
        EntityEventMessage absorbed = objectMapper.readValue(forB.get(1).getPayload(), EntityEventMessage.class);
        assertEquals("ABSORBED", absorbed.getPayload().path("role").asText());
        assertEquals(a.id().toString(), absorbed.getPayload().path("counterpartId").asText());
    }

    @Test
    @DisplayName("Unpublished messages drain oldest first; published and dead-lettered ones drop out")
    void drainOrderAndRetries() {
        EntityRef first = createContact("Ada", "Lovelace");
        EntityRef second = createContact("Bea", "Byron");
        entityEventService.updateFields(first, Map.of("title", "Countess"), null, "test");

        List<OutboxEvent> pending = outboxService.findUnpublishedEvents(10, 3);
        assertEquals(3, pending.size());
        assertEquals(first.id(), pending.get(0).getEntityId());
        assertEquals(second.id(), pending.get(1).getEntityId());
        assertEquals("Updated", pending.get(2).getEventType());

        outboxService.markPublished(pending.get(0).getId());
        for (int i = 0; i < 3; i++) {
            outboxService.markFailed(pending.get(1).getId(), "broker down");
        }

        List<OutboxEvent> remaining = outboxService.findUnpublishedEvents(10, 3);
        assertEquals(1, remaining.size());
        assertEquals(pending.get(2).getId(), remaining.get(0).getId());
        assertEquals(2, outboxService.countUnpublished());
        assertEquals(1, outboxEventRepository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(3));
    }
}
