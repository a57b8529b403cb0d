package com.flagship.entity_store.entity.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.entity_store.entity.EntityRef;
import com.flagship.entity_store.event.StoredEvent;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class EventResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("entity")
    EntityRef entity;

    @JsonProperty("sequence")
    long sequence;

    @JsonProperty("event_type")
    String eventType;

    @JsonProperty("payload")
    JsonNode payload;

    @JsonProperty("actor_id")
    String actorId;

    @JsonProperty("occurred_at")
    Instant occurredAt;

    @JsonProperty("dedup_key")
    String dedupKey;

    public static EventResponse from(StoredEvent event, ObjectMapper objectMapper) {
        return EventResponse.builder()
            .id(event.getId())
            .entity(event.getEntityRef())
            .sequence(event.getSequence())
            .eventType(event.getEventType())
            .payload(readPayload(event, objectMapper))
            .actorId(event.getActorId())
            .occurredAt(event.getOccurredAt())
            .dedupKey(event.getDedupKey())
            .build();
    }

    private static JsonNode readPayload(StoredEvent event, ObjectMapper objectMapper) {
        try {
            return objectMapper.readTree(event.getPayload());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored payload of event " + event.getId() + " is not JSON", e);
        }
    }
}
