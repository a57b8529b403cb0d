package com.flagship.entity_store.projection;

import com.flagship.entity_store.entity.EntityState;
import com.flagship.entity_store.entity.exception.ReplayGapException;
import com.flagship.entity_store.event.StoredEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Folds an ordered run of events onto a starting state through the handler registry.
 *
 * The run must continue the starting state's version without holes: the first event
 * is version + 1 and each next one is the previous + 1. Anything else means history
 * is missing and the fold refuses to guess.
 */
@Component
@RequiredArgsConstructor
public class EventReplayer {

    private final EventHandlerRegistry registry;

    public EntityState replay(EntityState start, List<StoredEvent> events) {
        EntityState state = start;
        long expected = start.getVersion() + 1;
        for (StoredEvent event : events) {
            if (event.getSequence() != expected) {
                throw new ReplayGapException(start.getRef(), expected, event.getSequence());
            }
            state = registry.apply(state, event);
            expected++;
        }
        return state;
    }
}
