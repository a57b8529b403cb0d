package com.flagship.entity_store.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.entity_store.entity.EntityRef;
import com.flagship.entity_store.entity.EntityType;
import com.flagship.entity_store.event.EventType;
import com.flagship.entity_store.event.payload.MergeRole;
import com.flagship.entity_store.outbox.EntityEventMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Translates relayed entity events into graph mirror calls.
 *
 * A merge reaches the mirror twice, once per participant. The survivor's copy updates
 * its node with the moved items and the absorbed copy folds the nodes together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GraphMirrorEventHandler {

    private final GraphMirror graphMirror;

    /**
     * @return false if the event type is not mirrored
     */
    public boolean handles(EntityEventMessage message) {
        return message.isErased() || EventType.fromWireName(message.getEventType())
            .map(EventType::isMirrored)
            .orElse(false);
    }

    public void handle(EntityEventMessage message) {
        EntityType type = EntityType.fromWireName(message.getEntityType());
        EntityRef ref = EntityRef.of(type, message.getEntityId());
        if (message.isErased()) {
            graphMirror.removeNode(ref, true);
            return;
        }

        JsonNode payload = message.getPayload();
        EventType eventType = EventType.fromWireName(message.getEventType())
            .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + message.getEventType()));
        switch (eventType) {
            case CREATED -> graphMirror.createNode(ref, payload);
            case UPDATED -> graphMirror.updateNode(ref, payload);
            case MERGED -> {
                UUID counterpart = uuid(payload, "counterpartId");
                if (MergeRole.ABSORBED.name().equals(text(payload, "role"))) {
                    graphMirror.mergeNodes(EntityRef.of(type, counterpart), ref);
                } else {
                    graphMirror.updateNode(ref, payload);
                }
            }
            case SPLIT -> graphMirror.splitNode(ref, EntityRef.of(type, uuid(payload, "newEntityId")));
            case DELETED -> graphMirror.removeNode(ref, false);
            default -> log.debug("Event type {} is not mirrored", eventType.wireName());
        }
    }

    private static String text(JsonNode payload, String field) {
        if (payload == null || !payload.hasNonNull(field)) {
            throw new IllegalArgumentException("Relayed payload is missing " + field);
        }
        return payload.get(field).asText();
    }

    private static UUID uuid(JsonNode payload, String field) {
        return UUID.fromString(text(payload, field));
    }
}
