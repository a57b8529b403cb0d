package com.flagship.entity_store.entity;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.entity_store.EntityStoreTestSupport;
import com.flagship.entity_store.entity.exception.EntityNotFoundException;
import com.flagship.entity_store.entity.exception.EntityStateException;
import com.flagship.entity_store.entity.exception.InvalidEventException;
import com.flagship.entity_store.event.EventLog;
import com.flagship.entity_store.event.EventType;
import com.flagship.entity_store.event.StoredEvent;
import com.flagship.entity_store.event.payload.AffiliationAdded;
import com.flagship.entity_store.event.payload.AffiliationEnded;
import com.flagship.entity_store.event.payload.EntityCreated;
import com.flagship.entity_store.event.payload.EntityMerged;
import com.flagship.entity_store.event.payload.FieldsUpdated;
import com.flagship.entity_store.event.payload.ItemRemoved;
import com.flagship.entity_store.event.payload.MergeRole;
import com.flagship.entity_store.outbox.OutboxService;
import com.flagship.entity_store.projection.ProjectionMaintenanceService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

class EntityEventServiceTest extends EntityStoreTestSupport {

    @Autowired
    private EventLog eventLog;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private ProjectionMaintenanceService maintenanceService;

    @Autowired
    private ObjectMapper objectMapper;

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Create, update, add identifier, then delete")
        void contactLifecycle() {
            EntityRef ref = createContact("Ada", "Byron");

            AppendResult updated = entityEventService.updateFields(ref, Map.of("last_name", "Lovelace"), null, "u1");
            AppendResult identified = addIdentifier(ref, "email", "ada@example.com");
            AppendResult deleted = entityEventService.delete(ref, "duplicate import", "u1");

            assertEquals(2, updated.getEvent().getSequence());
            assertEquals("Lovelace", updated.getState().getFields().get("last_name"));
            assertEquals(3, identified.getEvent().getSequence());
            assertEquals(ref.id(), identified.getState().getIdentifiers().get(0).getOriginEntityId());
            assertNotNull(identified.getState().getIdentifiers().get(0).getId());
            assertEquals(EntityStatus.DELETED, deleted.getState().getStatus());
            assertEquals(4, deleted.getState().getVersion());

            assertEquals(List.of(1L, 2L, 3L, 4L),
                eventLog.readAll(ref).stream().map(StoredEvent::getSequence).toList());
            assertEquals(deleted.getState(), entityEventService.getState(ref));
            assertFalse(maintenanceService.verify(ref).isDiverged());
        }

        @Test
        @DisplayName("A deleted entity accepts no further writes and leaves listings")
        void deletedIsTerminal() {
            EntityRef ref = createContact("Ada", "Byron");
            entityEventService.delete(ref, null, "u1");

            EntityStateException rejected = assertThrows(EntityStateException.class,
                () -> entityEventService.updateFields(ref, Map.of("title", "x"), null, "u1"));
            assertEquals(EntityStatus.DELETED, rejected.getStatus());
            assertThrows(EntityStateException.class, () -> entityEventService.delete(ref, null, "u1"));
            assertEquals(2, eventLog.count(ref));
        }

        @Test
        @DisplayName("Creating an id that already exists is rejected")
        void createTwice() {
            EntityRef ref = createContact("Ada", "Byron");

            assertThrows(EntityStateException.class, () -> entityEventService.create(ref.type(), ref.id(),
                EntityCreated.builder().build(), "u1", null));
        }

        @Test
        @DisplayName("Writes to an unknown entity are not found")
        void unknownEntity() {
            EntityRef ref = EntityRef.contact(UUID.randomUUID());

            assertThrows(EntityNotFoundException.class,
                () -> entityEventService.updateFields(ref, Map.of("a", "b"), null, "u1"));
            assertThrows(EntityNotFoundException.class, () -> entityEventService.getState(ref));
            assertThrows(EntityNotFoundException.class, () -> entityEventService.readEvents(ref, 0));
            assertEquals(0, eventLog.count(ref));
        }

        @Test
        @DisplayName("Affiliations link to live companies and can be ended once")
        void affiliations() {
            EntityRef company = createCompany("Analytical Engines Ltd");
            EntityRef contact = createContact("Ada", "Lovelace");

            AppendResult added = entityEventService.append(contact, EventType.AFFILIATION_ADDED,
                AffiliationAdded.builder().affiliation(Affiliation.builder()
                    .organization(company).role("Engineer").startedOn(LocalDate.of(1843, 1, 1)).build()).build(),
                "u1", null);
            Affiliation affiliation = added.getState().getAffiliations().get(0);
            assertTrue(affiliation.isCurrent());

            AppendResult ended = entityEventService.append(contact, EventType.AFFILIATION_ENDED,
                AffiliationEnded.builder().itemId(affiliation.getId()).build(), "u1", null);
            assertNotNull(ended.getState().getAffiliations().get(0).getEndedOn());

            assertThrows(InvalidEventException.class, () -> entityEventService.append(contact,
                EventType.AFFILIATION_ENDED, AffiliationEnded.builder().itemId(affiliation.getId()).build(), "u1", null));
        }
    }

    @Nested
    @DisplayName("Invalid events")
    class InvalidEvents {

        @Test
        @DisplayName("Unknown wire names are rejected on write")
        void unknownType() throws Exception {
            EntityRef ref = createContact("Ada", "Byron");

            assertThrows(InvalidEventException.class, () -> entityEventService.append(ref, "LoyaltyTierChanged",
                objectMapper.readTree("{}"), "u1", null));
            assertEquals(1, eventLog.count(ref));
        }

        @Test
        @DisplayName("Merged and Split cannot be appended directly")
        void coordinatedTypes() {
            EntityRef ref = createContact("Ada", "Byron");

            assertThrows(InvalidEventException.class, () -> entityEventService.append(ref, EventType.MERGED,
                EntityMerged.builder().role(MergeRole.SURVIVOR).counterpartId(UUID.randomUUID()).build(), "u1", null));
            assertEquals(1, eventLog.count(ref));
        }

        @Test
        @DisplayName("Payload problems are rejected before anything is stored")
        void badPayloads() throws Exception {
            EntityRef ref = createContact("Ada", "Byron");
            EntityRef otherContact = createContact("Charles", "Babbage");

            assertThrows(InvalidEventException.class,
                () -> entityEventService.updateFields(ref, Map.of(), List.of(), "u1"));
            assertThrows(InvalidEventException.class, () -> addIdentifier(ref, "email", " "));
            assertThrows(InvalidEventException.class, () -> entityEventService.append(ref,
                EventType.IDENTIFIER_REMOVED, ItemRemoved.builder().itemId(UUID.randomUUID()).build(), "u1", null));
            assertThrows(InvalidEventException.class, () -> entityEventService.append(ref,
                EventType.AFFILIATION_ADDED, AffiliationAdded.builder().affiliation(Affiliation.builder()
                    .organization(otherContact).build()).build(), "u1", null));
            assertThrows(InvalidEventException.class, () -> entityEventService.append(ref,
                EventType.AFFILIATION_ADDED, AffiliationAdded.builder().affiliation(Affiliation.builder()
                    .organization(EntityRef.company(UUID.randomUUID())).build()).build(), "u1", null));
            assertThrows(InvalidEventException.class, () -> entityEventService.append(ref, "Updated",
                objectMapper.readTree("{\"set\": [1, 2]}"), "u1", null));

            assertEquals(1, eventLog.count(ref));
        }
    }

    @Nested
    @DisplayName("Dedup keys")
    class DedupKeys {

        @Test
        @DisplayName("A repeated key returns the first event and appends nothing")
        void repeatedAppend() {
            EntityRef ref = createContact("Ada", "Byron");
            AppendResult first = entityEventService.append(ref, EventType.UPDATED,
                FieldsUpdated.builder().set(Map.of("title", "A")).build(),
                "u1", "req-1");
            AppendResult second = entityEventService.append(ref, EventType.UPDATED,
                FieldsUpdated.builder().set(Map.of("title", "B")).build(),
                "u1", "req-1");

            assertFalse(first.isDuplicate());
            assertTrue(second.isDuplicate());
            assertEquals(first.getEvent().getId(), second.getEvent().getId());
            assertEquals("A", second.getState().getFields().get("title"));
            assertEquals(2, eventLog.count(ref));
        }

        @Test
        @DisplayName("A retried create without an id lands on the same entity")
        void repeatedCreate() {
            AppendResult first = entityEventService.create(EntityType.COMPANY, null,
                EntityCreated.builder().fields(Map.of("name", "Acme")).build(), "u1", "import-7");
            AppendResult second = entityEventService.create(EntityType.COMPANY, null,
                EntityCreated.builder().fields(Map.of("name", "Acme")).build(), "u1", "import-7");

            assertTrue(second.isDuplicate());
            assertEquals(first.getState().getRef(), second.getState().getRef());
            assertEquals(1, eventLog.count(first.getState().getRef()));
        }

        @Test
        @DisplayName("The same key on different entities is independent")
        void keysArePerEntity() {
            EntityRef a = createContact("Ada", "Byron");
            EntityRef b = createContact("Charles", "Babbage");

            AppendResult onA = entityEventService.append(a, EventType.UPDATED,
                FieldsUpdated.builder().set(Map.of("x", "1")).build(),
                "u1", "shared");
            AppendResult onB = entityEventService.append(b, EventType.UPDATED,
                FieldsUpdated.builder().set(Map.of("x", "1")).build(),
                "u1", "shared");

            assertFalse(onA.isDuplicate());
            assertFalse(onB.isDuplicate());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("Fifty concurrent writers get consecutive sequences with no gaps or duplicates")
        void concurrentWriters() throws Exception {
            EntityRef ref = createContact("Ada", "Byron");
            int writers = 50;
            CountDownLatch startLatch = new CountDownLatch(1);
            CountDownLatch doneLatch = new CountDownLatch(writers);
            AtomicInteger failures = new AtomicInteger();
            List<Long> sequences = Collections.synchronizedList(new ArrayList<>());

            ExecutorService executor = Executors.newFixedThreadPool(writers);
            for (int i = 1; i <= writers; i++) {
                String value = String.valueOf(i);
                executor.submit(() -> {
                    try {
                        startLatch.await();
                        AppendResult result = entityEventService.updateFields(ref, Map.of("w" + value, value), null,
                            "writer-" + value);
                        sequences.add(result.getEvent().getSequence());
                    } catch (Exception e) {
                        failures.incrementAndGet();
                    } finally {
                        doneLatch.countDown();
                    }
                });
            }
            startLatch.countDown();
            assertTrue(doneLatch.await(60, TimeUnit.SECONDS));
            executor.shutdown();

            assertEquals(0, failures.get());
            List<Long> expected = LongStream.rangeClosed(2, writers + 1).boxed().toList();
            assertEquals(expected, sequences.stream().sorted().toList());
            assertEquals(expected.size() + 1L, eventLog.count(ref));

            EntityState state = entityEventService.getState(ref);
            assertEquals(writers + 1, state.getVersion());
            assertEquals(writers + 2, state.getFields().size());
            assertFalse(maintenanceService.verify(ref).isDiverged());
        }
    }

    @Nested
    @DisplayName("Relay")
    class Relay {

        @Test
        @DisplayName("Only mirrored event types are queued for the graph mirror")
        void mirroredTypesOnly() {
            EntityRef ref = createContact("Ada", "Byron");
            addIdentifier(ref, "email", "ada@example.com");
            entityEventService.updateFields(ref, Map.of("title", "Countess"), null, "u1");

            List<String> queued = outboxService.getEventsForEntity(ref).stream()
                .map(event -> event.getEventType())
                .toList();
            assertEquals(List.of("Created", "Updated"), queued);
        }
    }
}
