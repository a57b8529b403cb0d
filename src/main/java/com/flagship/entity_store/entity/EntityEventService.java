package com.flagship.entity_store.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.entity_store.entity.exception.EntityNotFoundException;
import com.flagship.entity_store.entity.exception.EntityStateException;
import com.flagship.entity_store.entity.exception.InvalidEventException;
import com.flagship.entity_store.event.EventLog;
import com.flagship.entity_store.event.EventType;
import com.flagship.entity_store.event.SequenceAllocation;
import com.flagship.entity_store.event.SequenceAllocator;
import com.flagship.entity_store.event.StoredEvent;
import com.flagship.entity_store.event.payload.AffiliationAdded;
import com.flagship.entity_store.event.payload.AffiliationEnded;
import com.flagship.entity_store.event.payload.ContactMethodAdded;
import com.flagship.entity_store.event.payload.EntityCreated;
import com.flagship.entity_store.event.payload.EntityDeleted;
import com.flagship.entity_store.event.payload.EventPayload;
import com.flagship.entity_store.event.payload.FieldsUpdated;
import com.flagship.entity_store.event.payload.IdentifierAdded;
import com.flagship.entity_store.event.payload.ItemRemoved;
import com.flagship.entity_store.event.payload.ProvenanceRecorded;
import com.flagship.entity_store.observability.CorrelationContext;
import com.flagship.entity_store.observability.EntityStoreMetrics;
import com.flagship.entity_store.outbox.EntityEventMessage;
import com.flagship.entity_store.outbox.OutboxService;
import com.flagship.entity_store.projection.EventHandlerRegistry;
import com.flagship.entity_store.projection.MaterializedViewStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The append-event API: the single write path of the entity store.
 *
 * One append is one transaction:
 * 1. Allocate the next sequence (takes the entity's row lock)
 * 2. Check the command against the current materialized state
 * 3. Append the event to the log
 * 4. Fold it into the materialized row
 * 5. Queue a relay message for mirrored event types
 *
 * Any failure rolls back all of it. Ordering conflicts re-run the transaction with a
 * fresh sequence, so callers never see them.
 *
 * Merged and Split are appended only by the merge coordinator through
 * {@link #appendInTransaction}.
 */
@Service
@Slf4j
public class EntityEventService {

    private final TransactionTemplate transactionTemplate;
    private final SequenceAllocator sequenceAllocator;
    private final EventLog eventLog;
    private final MaterializedViewStore viewStore;
    private final EventHandlerRegistry registry;
    private final OutboxService outboxService;
    private final DedupKeyService dedupKeyService;
    private final WriteRetrier retrier;
    private final EntityStoreMetrics metrics;
    private final ObjectMapper objectMapper;

    public EntityEventService(PlatformTransactionManager transactionManager,
                              SequenceAllocator sequenceAllocator,
                              EventLog eventLog,
                              MaterializedViewStore viewStore,
                              EventHandlerRegistry registry,
                              OutboxService outboxService,
                              DedupKeyService dedupKeyService,
                              WriteRetrier retrier,
                              EntityStoreMetrics metrics,
                              ObjectMapper objectMapper) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.sequenceAllocator = sequenceAllocator;
        this.eventLog = eventLog;
        this.viewStore = viewStore;
        this.registry = registry;
        this.outboxService = outboxService;
        this.dedupKeyService = dedupKeyService;
        this.retrier = retrier;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    // ==================== Commands ====================

    /**
     * Creates an entity. Without an explicit id, a dedup key yields a stable id so a
     * retried create lands on the same entity and is recognized as a duplicate.
     */
    public AppendResult create(EntityType type, UUID requestedId, EntityCreated payload,
                               String actorId, String dedupKey) {
        UUID id = requestedId;
        if (id == null) {
            id = dedupKey != null
                ? UUID.nameUUIDFromBytes((type.wireName() + ":" + dedupKey).getBytes(StandardCharsets.UTF_8))
                : UUID.randomUUID();
        }
        return append(EntityRef.of(type, id), EventType.CREATED, payload, actorId, dedupKey);
    }

    public AppendResult updateFields(EntityRef ref, Map<String, String> set, List<String> cleared, String actorId) {
        FieldsUpdated payload = FieldsUpdated.builder()
            .set(set != null ? set : Map.of())
            .cleared(cleared != null ? cleared : List.of())
            .build();
        return append(ref, EventType.UPDATED, payload, actorId, null);
    }

    public AppendResult addIdentifier(EntityRef ref, String identifierType, String value, String actorId) {
        Identifier identifier = Identifier.builder().type(identifierType).value(value).build();
        return append(ref, EventType.IDENTIFIER_ADDED, IdentifierAdded.builder().identifier(identifier).build(),
            actorId, null);
    }

    public AppendResult delete(EntityRef ref, String reason, String actorId) {
        return append(ref, EventType.DELETED, EntityDeleted.builder().reason(reason).build(), actorId, null);
    }

    /**
     * Appends a cataloged event given by wire name with a JSON payload.
     */
    public AppendResult append(EntityRef ref, String eventType, JsonNode payload, String actorId, String dedupKey) {
        EventType type = EventType.fromWireName(eventType)
            .orElseThrow(() -> new InvalidEventException("Unknown event type: " + eventType));
        if (payload == null || payload.isNull()) {
            throw new InvalidEventException("Payload is required for " + eventType);
        }
        return append(ref, type, registry.decode(type, payload), actorId, dedupKey);
    }

    /**
     * Appends an event in its own transaction, retrying ordering conflicts.
     *
     * @param dedupKey optional; a repeated key for the same entity returns the event
     *                 stored the first time instead of appending again
     */
    public AppendResult append(EntityRef ref, EventType type, EventPayload payload, String actorId, String dedupKey) {
        if (type.isCoordinated()) {
            throw new InvalidEventException(type.wireName() + " events are appended by merge and split only");
        }
        long start = System.currentTimeMillis();

        Optional<AppendResult> cached = findCachedDuplicate(ref, dedupKey);
        if (cached.isPresent()) {
            return cached.get();
        }

        AppendResult result = retrier.execute("append", () -> transactionTemplate.execute(
            status -> appendInTransaction(ref, type, payload, actorId, dedupKey)));

        if (result.isDuplicate()) {
            metrics.recordDedupHit("event_log");
        } else {
            dedupKeyService.remember(ref, dedupKey, result.getEvent().getId());
        }
        metrics.recordAppend(ref.type().wireName(), type.wireName(), result.isDuplicate() ? "duplicate" : "appended");
        metrics.recordAppendLatency(ref.type().wireName(), System.currentTimeMillis() - start);
        if (type == EventType.CREATED && !result.isDuplicate()) {
            log.info("Created {} ({})", ref, result.getState().getDisplayName());
        }
        return result;
    }

    /**
     * Appends within the caller's transaction. The caller owns retries.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AppendResult appendInTransaction(EntityRef ref, EventType type, EventPayload payload,
                                            String actorId, String dedupKey) {
        try (MDC.MDCCloseable ignored = CorrelationContext.withEntity(ref)) {
            if (payload == null) {
                throw new InvalidEventException("Payload is required for " + type.wireName());
            }
            if (dedupKey != null) {
                sequenceAllocator.lock(ref);
                Optional<StoredEvent> existing = eventLog.findByDedupKey(ref, dedupKey);
                if (existing.isPresent()) {
                    log.debug("Dedup key {} already used by {} #{}", dedupKey, ref, existing.get().getSequence());
                    return new AppendResult(existing.get(), viewStore.loadOrEmpty(ref), true);
                }
            }

            SequenceAllocation slot = sequenceAllocator.nextSequence(ref);
            EntityState current = viewStore.loadOrEmpty(ref);
            checkLifecycle(ref, current, type);
            EventPayload prepared = prepare(ref, type, payload, current, slot.getOccurredAt());

            StoredEvent event = StoredEvent.builder()
                .id(UUID.randomUUID())
                .entityType(ref.type())
                .entityId(ref.id())
                .sequence(slot.getSequence())
                .eventType(type.wireName())
                .payload(serialize(prepared))
                .actorId(actorId)
                .occurredAt(slot.getOccurredAt())
                .dedupKey(dedupKey)
                .build();

            eventLog.append(event);
            EntityState next = viewStore.applyAndPersist(current, event);

            if (type.isMirrored()) {
                outboxService.saveEvent(ref, type.wireName(), relayMessage(event, prepared));
            }
            return new AppendResult(event, next, false);
        }
    }

    // ==================== Queries ====================

    public EntityState getState(EntityRef ref) {
        return viewStore.load(ref).orElseThrow(() -> new EntityNotFoundException(ref));
    }

    public List<StoredEvent> readEvents(EntityRef ref, long afterSequence) {
        List<StoredEvent> events = eventLog.readAfter(ref, afterSequence);
        if (events.isEmpty() && afterSequence == 0 && viewStore.load(ref).isEmpty()) {
            throw new EntityNotFoundException(ref);
        }
        return events;
    }

    // ==================== Internals ====================

    private Optional<AppendResult> findCachedDuplicate(EntityRef ref, String dedupKey) {
        return dedupKeyService.lookup(ref, dedupKey)
            .flatMap(eventLog::findById)
            .filter(event -> event.getEntityRef().equals(ref))
            .map(event -> {
                metrics.recordDedupHit("redis");
                return new AppendResult(event, viewStore.loadOrEmpty(ref), true);
            });
    }

    private void checkLifecycle(EntityRef ref, EntityState current, EventType type) {
        if (type == EventType.CREATED) {
            if (current.exists()) {
                throw new EntityStateException(ref, current.getStatus(), ref + " already exists");
            }
            return;
        }
        if (!current.exists()) {
            throw new EntityNotFoundException(ref);
        }
        if (!current.isActive()) {
            throw new EntityStateException(ref, current.getStatus(),
                String.format("%s is %s and accepts no further writes", ref, current.getStatus()));
        }
    }

    /**
     * Checks the payload shape and fills in item ids, origins and defaults, so the
     * stored payload is complete and the fold needs no generated values.
     */
    private EventPayload prepare(EntityRef ref, EventType type, EventPayload payload,
                                 EntityState current, Instant occurredAt) {
        switch (type) {
            case CREATED -> {
                EntityCreated created = (EntityCreated) payload;
                checkFieldNames(created.getFields().keySet());
                return created.toBuilder()
                    .identifiers(created.getIdentifiers().stream().map(i -> prepareIdentifier(ref, i)).toList())
                    .contactMethods(created.getContactMethods().stream().map(c -> prepareContactMethod(ref, c)).toList())
                    .affiliations(created.getAffiliations().stream().map(a -> prepareAffiliation(ref, a)).toList())
                    .provenance(created.getProvenance().stream().map(p -> prepareProvenance(ref, p, occurredAt)).toList())
                    .build();
            }
            case UPDATED -> {
                FieldsUpdated updated = (FieldsUpdated) payload;
                if (updated.getSet().isEmpty() && updated.getCleared().isEmpty()) {
                    throw new InvalidEventException("Updated needs at least one field to set or clear");
                }
                checkFieldNames(updated.getSet().keySet());
                checkFieldNames(updated.getCleared());
                return updated;
            }
            case IDENTIFIER_ADDED -> {
                Identifier identifier = require(((IdentifierAdded) payload).getIdentifier(), "identifier");
                return IdentifierAdded.builder().identifier(prepareIdentifier(ref, identifier)).build();
            }
            case CONTACT_METHOD_ADDED -> {
                ContactMethod method = require(((ContactMethodAdded) payload).getContactMethod(), "contactMethod");
                return ContactMethodAdded.builder().contactMethod(prepareContactMethod(ref, method)).build();
            }
            case AFFILIATION_ADDED -> {
                Affiliation affiliation = require(((AffiliationAdded) payload).getAffiliation(), "affiliation");
                return AffiliationAdded.builder().affiliation(prepareAffiliation(ref, affiliation)).build();
            }
            case IDENTIFIER_REMOVED -> {
                requireItem(current.getIdentifiers(), ((ItemRemoved) payload).getItemId(), "identifier");
                return payload;
            }
            case CONTACT_METHOD_REMOVED -> {
                requireItem(current.getContactMethods(), ((ItemRemoved) payload).getItemId(), "contact method");
                return payload;
            }
            case AFFILIATION_ENDED -> {
                AffiliationEnded ended = (AffiliationEnded) payload;
                Affiliation affiliation = requireItem(current.getAffiliations(), ended.getItemId(), "affiliation");
                if (!affiliation.isCurrent()) {
                    throw new InvalidEventException("Affiliation " + ended.getItemId() + " has already ended");
                }
                return ended.getEndedOn() != null ? ended : AffiliationEnded.builder()
                    .itemId(ended.getItemId())
                    .endedOn(LocalDate.ofInstant(occurredAt, ZoneOffset.UTC))
                    .build();
            }
            case PROVENANCE_RECORDED -> {
                ProvenanceRecord record = require(((ProvenanceRecorded) payload).getRecord(), "record");
                return ProvenanceRecorded.builder().record(prepareProvenance(ref, record, occurredAt)).build();
            }
            default -> {
                return payload;
            }
        }
    }

    private Identifier prepareIdentifier(EntityRef ref, Identifier identifier) {
        if (isBlank(identifier.getType()) || isBlank(identifier.getValue())) {
            throw new InvalidEventException("Identifier needs a type and a value");
        }
        return identifier.toBuilder()
            .id(identifier.getId() != null ? identifier.getId() : UUID.randomUUID())
            .originEntityId(identifier.getOriginEntityId() != null ? identifier.getOriginEntityId() : ref.id())
            .build();
    }

    private ContactMethod prepareContactMethod(EntityRef ref, ContactMethod method) {
        if (method.getKind() == null || isBlank(method.getValue())) {
            throw new InvalidEventException("Contact method needs a kind and a value");
        }
        return method.toBuilder()
            .id(method.getId() != null ? method.getId() : UUID.randomUUID())
            .originEntityId(method.getOriginEntityId() != null ? method.getOriginEntityId() : ref.id())
            .build();
    }

    private Affiliation prepareAffiliation(EntityRef ref, Affiliation affiliation) {
        EntityRef organization = affiliation.getOrganization();
        if (organization == null || organization.type() != EntityType.COMPANY) {
            throw new InvalidEventException("Affiliation needs a company reference as organization");
        }
        if (organization.equals(ref)) {
            throw new InvalidEventException("An entity cannot be affiliated with itself");
        }
        // Items moved by a split already carry their origin and keep the reference they were recorded with.
        boolean moved = affiliation.getOriginEntityId() != null;
        // The organization's write lock orders this against a merge that absorbs it.
        boolean organizationLive = moved || (sequenceAllocator.lock(organization)
            && viewStore.load(organization).map(EntityState::isActive).orElse(false));
        if (!organizationLive) {
            throw new InvalidEventException("Organization " + organization + " does not exist or is not active");
        }
        return affiliation.toBuilder()
            .id(affiliation.getId() != null ? affiliation.getId() : UUID.randomUUID())
            .originEntityId(affiliation.getOriginEntityId() != null ? affiliation.getOriginEntityId() : ref.id())
            .build();
    }

    private ProvenanceRecord prepareProvenance(EntityRef ref, ProvenanceRecord record, Instant occurredAt) {
        if (isBlank(record.getSource())) {
            throw new InvalidEventException("Provenance record needs a source");
        }
        return record.toBuilder()
            .id(record.getId() != null ? record.getId() : UUID.randomUUID())
            .originEntityId(record.getOriginEntityId() != null ? record.getOriginEntityId() : ref.id())
            .recordedAt(record.getRecordedAt() != null ? record.getRecordedAt() : occurredAt)
            .build();
    }

    private static <T extends OwnedItem> T requireItem(List<T> items, UUID itemId, String kind) {
        if (itemId == null) {
            throw new InvalidEventException("itemId is required");
        }
        return items.stream()
            .filter(item -> item.getId().equals(itemId))
            .findFirst()
            .orElseThrow(() -> new InvalidEventException("No " + kind + " with id " + itemId));
    }

    private static <T> T require(T value, String name) {
        if (value == null) {
            throw new InvalidEventException(name + " is required");
        }
        return value;
    }

    private static void checkFieldNames(Iterable<String> names) {
        for (String name : names) {
            if (isBlank(name)) {
                throw new InvalidEventException("Field names must not be blank");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private EntityEventMessage relayMessage(StoredEvent event, EventPayload payload) {
        return EntityEventMessage.builder()
            .eventId(event.getId())
            .entityType(event.getEntityType().wireName())
            .entityId(event.getEntityId())
            .sequence(event.getSequence())
            .eventType(event.getEventType())
            .actorId(event.getActorId())
            .occurredAt(event.getOccurredAt())
            .payload(objectMapper.valueToTree(payload))
            .erased(false)
            .build();
    }

    private String serialize(EventPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new InvalidEventException("Failed to serialize event payload", e);
        }
    }
}
