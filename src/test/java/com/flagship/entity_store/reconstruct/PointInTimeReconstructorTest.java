package com.flagship.entity_store.reconstruct;

import com.flagship.entity_store.EntityStoreTestSupport;
import com.flagship.entity_store.entity.EntityRef;
import com.flagship.entity_store.entity.EntityState;
import com.flagship.entity_store.entity.EntityStatus;
import com.flagship.entity_store.entity.exception.ReplayGapException;
import com.flagship.entity_store.event.EventLog;
import com.flagship.entity_store.event.StoredEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PointInTimeReconstructorTest extends EntityStoreTestSupport {

    @Autowired
    private PointInTimeReconstructor reconstructor;

    @Autowired
    private EventLog eventLog;

    @Test
    @DisplayName("State as of a past instant ignores later events")
    void asOfBeforeUpdate() throws Exception {
        EntityRef ref = createContact("Ada", "Byron");
        Thread.sleep(5);
        entityEventService.updateFields(ref, Map.of("last_name", "Lovelace"), null, "test");

        List<StoredEvent> events = eventLog.readAll(ref);
        Instant created = events.get(0).getOccurredAt();
        Instant updated = events.get(1).getOccurredAt();
        assertTrue(updated.isAfter(created));

        EntityState before = reconstructor.stateAsOf(ref, created);
        EntityState after = reconstructor.stateAsOf(ref, updated);

        assertEquals("Byron", before.getFields().get("last_name"));
        assertEquals(1, before.getVersion());
        assertEquals("Lovelace", after.getFields().get("last_name"));
        assertEquals(entityEventService.getState(ref), after);
    }

    @Test
    @DisplayName("Before the first event the entity does not exist")
    void beforeCreation() {
        EntityRef ref = createContact("Ada", "Byron");
        Instant created = eventLog.readAll(ref).get(0).getOccurredAt();

        EntityState state = reconstructor.stateAsOf(ref, created.minusMillis(1));

        assertFalse(state.exists());
        assertEquals(0, state.getVersion());
    }

    @Test
    @DisplayName("A deleted entity reads as deleted now and active before the delete")
    void acrossDeletion() throws Exception {
        EntityRef ref = createCompany("Analytical Engines Ltd");
        Instant beforeDelete = eventLog.readAll(ref).get(0).getOccurredAt();
        Thread.sleep(5);
        entityEventService.delete(ref, "closed", "test");

        assertEquals(EntityStatus.ACTIVE, reconstructor.stateAsOf(ref, beforeDelete).getStatus());
        assertEquals(EntityStatus.DELETED, reconstructor.stateAsOf(ref, Instant.now().plusSeconds(1)).getStatus());
    }

    @Test
    @DisplayName("Exact-sequence reads fail rather than return a shorter history")
    void stateAtSequenceBeyondLog() {
        EntityRef ref = createContact("Ada", "Byron");
        entityEventService.updateFields(ref, Map.of("title", "Countess"), null, "test");

        assertEquals(2, reconstructor.stateAtSequence(ref, 2).getVersion());
        assertEquals(1, reconstructor.stateAtSequence(ref, 1).getVersion());
        assertThrows(ReplayGapException.class, () -> reconstructor.stateAtSequence(ref, 5));
    }
}
