package com.flagship.entity_store.entity.exception;

import com.flagship.entity_store.entity.EntityRef;
import com.flagship.entity_store.entity.EntityStatus;
import lombok.Getter;

/**
 * A command is not valid for the entity's lifecycle state, e.g. a write to a merged
 * entity or a create over an existing one.
 */
@Getter
public class EntityStateException extends RuntimeException {

    private final EntityRef entityRef;
    private final EntityStatus status;

    public EntityStateException(EntityRef entityRef, EntityStatus status, String message) {
        super(message);
        this.entityRef = entityRef;
        this.status = status;
    }
}
