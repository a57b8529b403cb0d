package com.flagship.entity_store.event.payload;

/**
 * Marker for the payload of a cataloged event type.
 *
 * Payloads are immutable and serialized as JSON into the event log.
 */
public interface EventPayload {
}
