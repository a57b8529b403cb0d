package com.flagship.entity_store.entity.exception;

import com.flagship.entity_store.entity.EntityRef;
import lombok.Getter;

/**
 * The event history needed to reconstruct an entity is incomplete.
 *
 * Raised instead of returning a state that silently skips missing events.
 * Not retryable; needs manual repair of the log.
 */
@Getter
public class ReplayGapException extends RuntimeException {

    private final EntityRef entityRef;
    private final long expectedSequence;
    private final long foundSequence;

    public ReplayGapException(EntityRef entityRef, long expectedSequence, long foundSequence) {
        super(String.format("Insufficient history for %s: expected event %d but found %s",
                entityRef, expectedSequence, foundSequence < 0 ? "none" : String.valueOf(foundSequence)));
        this.entityRef = entityRef;
        this.expectedSequence = expectedSequence;
        this.foundSequence = foundSequence;
    }
}
