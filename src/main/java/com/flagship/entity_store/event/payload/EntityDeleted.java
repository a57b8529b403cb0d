package com.flagship.entity_store.event.payload;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class EntityDeleted implements EventPayload {
    String reason;
}
