package com.flagship.entity_store.entity.exception;

import com.flagship.entity_store.entity.EntityRef;
import lombok.Getter;

/**
 * Two writers raced for the same sequence slot of an entity.
 *
 * Always retryable: the write path retries with a freshly allocated sequence and only
 * lets this escape once the retry budget is exhausted.
 */
@Getter
public class OrderingConflictException extends RuntimeException {

    private final EntityRef entityRef;

    public OrderingConflictException(EntityRef entityRef, String message) {
        super(message);
        this.entityRef = entityRef;
    }

    public OrderingConflictException(EntityRef entityRef, String message, Throwable cause) {
        super(message, cause);
        this.entityRef = entityRef;
    }
}
