package com.flagship.entity_store.event;

import com.flagship.entity_store.entity.EntityRef;
import com.flagship.entity_store.entity.EntityType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable record of one state change to one entity, as held in the event log.
 *
 * The event type is kept as its wire name so that rows written by a newer release
 * can still be read and folded as no-ops.
 */
@Value
@Builder
public class StoredEvent {
    UUID id;
    EntityType entityType;
    UUID entityId;
    long sequence;
    String eventType;
    String payload;        // JSON
    String actorId;        // null for system-originated events
    Instant occurredAt;
    String dedupKey;

    public EntityRef getEntityRef() {
        return EntityRef.of(entityType, entityId);
    }

    public Optional<EventType> knownType() {
        return EventType.fromWireName(eventType);
    }
}
