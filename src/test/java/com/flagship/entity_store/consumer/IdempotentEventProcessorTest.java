package com.flagship.entity_store.consumer;

import com.flagship.entity_store.EntityStoreTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class IdempotentEventProcessorTest extends EntityStoreTestSupport {

    private static final String EVENT_TYPE = "Created";
    private static final String ENTITY_TYPE = "contact";

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    @Autowired
    private ProcessedEventRepository repository;

    @Test
    @DisplayName("First delivery runs the handler and records it")
    void firstDeliveryRunsHandler() {
        UUID eventId = UUID.randomUUID();
        UUID entityId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        boolean processed = eventProcessor.processEvent(eventId, EVENT_TYPE, ENTITY_TYPE, entityId,
            calls::incrementAndGet);

        assertTrue(processed);
        assertEquals(1, calls.get());
        assertTrue(eventProcessor.isAlreadyProcessed(eventId));
        ProcessedEvent recorded = repository.findById(eventId).orElseThrow().toDomain();
        assertEquals(ProcessedEvent.ProcessingResult.SUCCESS, recorded.getResult());
        assertEquals(entityId, recorded.getEntityId());
    }

    @Test
    @DisplayName("Redelivered events do not run the handler again")
    void redeliverySkipsHandler() {
        UUID eventId = UUID.randomUUID();
        UUID entityId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        boolean first = eventProcessor.processEvent(eventId, EVENT_TYPE, ENTITY_TYPE, entityId,
            calls::incrementAndGet);
        boolean second = eventProcessor.processEvent(eventId, EVENT_TYPE, ENTITY_TYPE, entityId,
            calls::incrementAndGet);
        boolean third = eventProcessor.processEvent(eventId, EVENT_TYPE, ENTITY_TYPE, entityId,
            calls::incrementAndGet);

        assertTrue(first);
        assertFalse(second);
        assertFalse(third);
        assertEquals(1, calls.get());
        assertEquals(1, repository.count());
    }

    @Test
    @DisplayName("A failing handler leaves no ledger row so the redelivery runs it again")
    void failedHandlerIsRetried() {
        UUID eventId = UUID.randomUUID();
        UUID entityId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () ->
            eventProcessor.processEvent(eventId, EVENT_TYPE, ENTITY_TYPE, entityId, () -> {
                calls.incrementAndGet();
                throw new IllegalStateException("graph unavailable");
            }));

        assertEquals("graph unavailable", thrown.getMessage());
        assertFalse(eventProcessor.isAlreadyProcessed(eventId));

        boolean retried = eventProcessor.processEvent(eventId, EVENT_TYPE, ENTITY_TYPE, entityId,
            calls::incrementAndGet);

        assertTrue(retried);
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("Skipped events are recorded with their reason and not processed later")
    void skippedEventsAreRecorded() {
        UUID eventId = UUID.randomUUID();
        UUID entityId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        eventProcessor.skipEvent(eventId, "IdentifierAdded", ENTITY_TYPE, entityId, "Not mirrored");
        eventProcessor.skipEvent(eventId, "IdentifierAdded", ENTITY_TYPE, entityId, "Not mirrored");

        assertEquals(1, repository.countByResult(ProcessedEvent.ProcessingResult.SKIPPED));
        assertEquals("Not mirrored", repository.findById(eventId).orElseThrow().getErrorMessage());
        assertFalse(eventProcessor.processEvent(eventId, "IdentifierAdded", ENTITY_TYPE, entityId,
            calls::incrementAndGet));
        assertEquals(0, calls.get());
    }

    @Test
    @DisplayName("Ledger rows are listed per entity in processing order")
    void ledgerPerEntity() {
        UUID entityId = UUID.randomUUID();
        UUID created = UUID.randomUUID();
        UUID updated = UUID.randomUUID();

        eventProcessor.processEvent(created, "Created", ENTITY_TYPE, entityId, () -> { });
        eventProcessor.processEvent(updated, "Updated", ENTITY_TYPE, entityId, () -> { });
        eventProcessor.processEvent(UUID.randomUUID(), "Created", ENTITY_TYPE, UUID.randomUUID(), () -> { });

        List<ProcessedEventEntity> rows =
            repository.findByEntityTypeAndEntityIdOrderByProcessedAtAsc(ENTITY_TYPE, entityId);

        assertEquals(2, rows.size());
        assertTrue(rows.stream().anyMatch(row -> row.getEventId().equals(created)));
        assertTrue(rows.stream().anyMatch(row -> row.getEventId().equals(updated)));
    }
}
