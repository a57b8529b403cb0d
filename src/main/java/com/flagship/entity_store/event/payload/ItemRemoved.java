package com.flagship.entity_store.event.payload;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

/**
 * Payload of IdentifierRemoved and ContactMethodRemoved.
 */
@Value
@Builder
@Jacksonized
public class ItemRemoved implements EventPayload {
    UUID itemId;
    String reason;
}
