package com.flagship.entity_store.projection;

import com.flagship.entity_store.entity.EntityState;
import com.flagship.entity_store.event.StoredEvent;
import com.flagship.entity_store.event.payload.EventPayload;

/**
 * Pure fold step for one event type: no I/O, same output for the same inputs.
 */
@FunctionalInterface
public interface EventHandler<P extends EventPayload> {

    EntityState apply(EntityState state, P payload, StoredEvent event);
}
