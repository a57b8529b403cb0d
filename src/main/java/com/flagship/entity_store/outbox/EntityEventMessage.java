package com.flagship.entity_store.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * Message relayed to the graph mirror for a committed event.
 *
 * For compliance erasure the message is metadata only: eventType "Deleted",
 * erased true, no payload and no sequence.
 */
@Value
@Builder
@Jacksonized
public class EntityEventMessage {
    UUID eventId;
    String entityType;
    UUID entityId;
    long sequence;
    String eventType;
    String actorId;
    Instant occurredAt;
    JsonNode payload;
    boolean erased;
}
