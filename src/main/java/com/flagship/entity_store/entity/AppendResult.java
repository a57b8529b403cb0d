package com.flagship.entity_store.entity;

import com.flagship.entity_store.event.StoredEvent;
import lombok.Value;

/**
 * Outcome of an append: the stored event and the entity state right after it.
 *
 * For a repeated dedup key, duplicate is true, the event is the one stored the first
 * time and the state is the current one.
 */
@Value
public class AppendResult {
    StoredEvent event;
    EntityState state;
    boolean duplicate;
}
