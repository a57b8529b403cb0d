package com.flagship.entity_store.outbox;

import com.flagship.entity_store.entity.EntityRef;
import com.flagship.entity_store.entity.EntityType;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A relay message for one committed entity event.
 *
 * sequenceNumber is assigned by the database on insert and orders the relay across
 * all entities.
 */
@Value
public class OutboxEvent {
    UUID id;
    String entityType;
    UUID entityId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    static OutboxEvent pending(EntityRef ref, String eventType, String payload, Instant now) {
        return new OutboxEvent(UUID.randomUUID(), ref.type().wireName(), ref.id(), eventType, payload, now,
            null, 0, null, null);
    }

    public EntityRef getEntityRef() {
        return EntityRef.of(EntityType.fromWireName(entityType), entityId);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
