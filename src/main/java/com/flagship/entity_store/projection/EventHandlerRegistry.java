package com.flagship.entity_store.projection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.entity_store.entity.EntityState;
import com.flagship.entity_store.entity.exception.InvalidEventException;
import com.flagship.entity_store.event.EventType;
import com.flagship.entity_store.event.StoredEvent;
import com.flagship.entity_store.event.payload.AffiliationAdded;
import com.flagship.entity_store.event.payload.AffiliationEnded;
import com.flagship.entity_store.event.payload.AffiliationsRepointed;
import com.flagship.entity_store.event.payload.ContactMethodAdded;
import com.flagship.entity_store.event.payload.EntityCreated;
import com.flagship.entity_store.event.payload.EntityDeleted;
import com.flagship.entity_store.event.payload.EntityMerged;
import com.flagship.entity_store.event.payload.EntitySplit;
import com.flagship.entity_store.event.payload.EventPayload;
import com.flagship.entity_store.event.payload.FieldsUpdated;
import com.flagship.entity_store.event.payload.IdentifierAdded;
import com.flagship.entity_store.event.payload.ItemRemoved;
import com.flagship.entity_store.event.payload.ProvenanceRecorded;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps each cataloged event type to its fold step.
 *
 * The same registry instance serves the live write path and every replay path
 * (rebuild, verification, snapshots, point-in-time reads). That sharing is what keeps
 * a materialized row equal to the fold of its events.
 *
 * Wire names outside the catalog are folded as no-ops that only advance the version,
 * with a warning.
 */
@Component
@Slf4j
public class EventHandlerRegistry {

    private final ObjectMapper objectMapper;
    private final Map<EventType, Registration<?>> registrations = new EnumMap<>(EventType.class);

    public EventHandlerRegistry(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;

        register(EventType.CREATED, EntityCreated.class, EntityEventHandlers::created);
        register(EventType.UPDATED, FieldsUpdated.class, EntityEventHandlers::updated);
        register(EventType.IDENTIFIER_ADDED, IdentifierAdded.class, EntityEventHandlers::identifierAdded);
        register(EventType.IDENTIFIER_REMOVED, ItemRemoved.class, EntityEventHandlers::identifierRemoved);
        register(EventType.CONTACT_METHOD_ADDED, ContactMethodAdded.class, EntityEventHandlers::contactMethodAdded);
        register(EventType.CONTACT_METHOD_REMOVED, ItemRemoved.class, EntityEventHandlers::contactMethodRemoved);
        register(EventType.AFFILIATION_ADDED, AffiliationAdded.class, EntityEventHandlers::affiliationAdded);
        register(EventType.AFFILIATION_ENDED, AffiliationEnded.class, EntityEventHandlers::affiliationEnded);
        register(EventType.AFFILIATIONS_REPOINTED, AffiliationsRepointed.class,
            EntityEventHandlers::affiliationsRepointed);
        register(EventType.PROVENANCE_RECORDED, ProvenanceRecorded.class, EntityEventHandlers::provenanceRecorded);
        register(EventType.MERGED, EntityMerged.class, EntityEventHandlers::merged);
        register(EventType.SPLIT, EntitySplit.class, EntityEventHandlers::split);
        register(EventType.DELETED, EntityDeleted.class, EntityEventHandlers::deleted);

        for (EventType type : EventType.values()) {
            if (!registrations.containsKey(type)) {
                throw new IllegalStateException("No handler registered for " + type.wireName());
            }
        }
    }

    /**
     * Folds one event into a state. The result carries the event's sequence as its
     * version and the event's timestamp as its last update.
     */
    public EntityState apply(EntityState state, StoredEvent event) {
        Optional<EventType> type = event.knownType();
        EntityState next;
        if (type.isEmpty()) {
            log.warn("Unknown event type '{}' at {} #{}; folding as no-op",
                    event.getEventType(), event.getEntityRef(), event.getSequence());
            next = state;
        } else {
            next = dispatch(registrations.get(type.get()), state, event);
        }
        return next.toBuilder()
            .version(event.getSequence())
            .updatedAt(event.getOccurredAt())
            .build();
    }

    public boolean isRegistered(String wireName) {
        return EventType.fromWireName(wireName).map(registrations::containsKey).orElse(false);
    }

    /**
     * Decodes a stored payload into its catalog type.
     */
    public <P extends EventPayload> P decode(StoredEvent event, Class<P> payloadType) {
        try {
            return objectMapper.readValue(event.getPayload(), payloadType);
        } catch (JsonProcessingException e) {
            throw new InvalidEventException(String.format("Unreadable %s payload at %s #%d",
                    event.getEventType(), event.getEntityRef(), event.getSequence()), e);
        }
    }

    /**
     * Decodes a caller-supplied payload for an event type.
     *
     * @throws InvalidEventException if the payload does not fit the catalog shape
     */
    public EventPayload decode(EventType type, JsonNode payload) {
        try {
            return objectMapper.treeToValue(payload, type.payloadType());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidEventException("Payload does not match " + type.wireName() + ": " + e.getMessage(), e);
        }
    }

    private <P extends EventPayload> EntityState dispatch(Registration<P> registration, EntityState state,
                                                          StoredEvent event) {
        P payload = decode(event, registration.payloadType());
        return registration.handler().apply(state, payload, event);
    }

    private <P extends EventPayload> void register(EventType type, Class<P> payloadType, EventHandler<P> handler) {
        if (!type.payloadType().equals(payloadType)) {
            throw new IllegalStateException(type.wireName() + " carries " + type.payloadType().getSimpleName());
        }
        registrations.put(type, new Registration<>(payloadType, handler));
    }

    private record Registration<P extends EventPayload>(Class<P> payloadType, EventHandler<P> handler) {
    }
}
