package com.flagship.entity_store.projection;

import com.flagship.entity_store.entity.EntityRef;
import com.flagship.entity_store.entity.EntityState;
import com.flagship.entity_store.entity.exception.EntityNotFoundException;
import com.flagship.entity_store.event.EventLog;
import com.flagship.entity_store.event.SequenceAllocator;
import com.flagship.entity_store.event.StoredEvent;
import com.flagship.entity_store.observability.EntityStoreMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks and repairs the fold invariant: a materialized row equals the fold of all
 * its entity's events from the empty state.
 *
 * Both operations replay from sequence 1 and ignore snapshots.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectionMaintenanceService {

    private final EventLog eventLog;
    private final SequenceAllocator sequenceAllocator;
    private final EventReplayer replayer;
    private final MaterializedViewStore viewStore;
    private final EntityStoreMetrics metrics;

    /**
     * Diffs the live row against a full replay. Read-only.
     */
    @Transactional(readOnly = true)
    public DivergenceReport verify(EntityRef ref) {
        List<StoredEvent> events = eventLog.readAll(ref);
        Optional<EntityState> live = viewStore.load(ref);
        if (events.isEmpty() && live.isEmpty()) {
            throw new EntityNotFoundException(ref);
        }
        EntityState replayed = replayer.replay(EntityState.empty(ref), events);
        List<String> differences = diff(live.orElse(null), replayed);
        if (!differences.isEmpty()) {
            log.warn("Materialized row of {} diverges from its history: {}", ref, differences);
            metrics.recordDivergence(ref.type().wireName(), false);
        }
        return new DivergenceReport(ref, live.map(EntityState::getVersion).orElse(0L),
                replayed.getVersion(), differences, false);
    }

    /**
     * Rebuilds the row from the event log. Holds the entity's write lock so no append
     * can slip in between the read and the write.
     */
    @Transactional
    public DivergenceReport rebuild(EntityRef ref) {
        sequenceAllocator.lock(ref);
        List<StoredEvent> events = eventLog.readAll(ref);
        Optional<EntityState> live = viewStore.load(ref);
        if (events.isEmpty()) {
            if (live.isEmpty()) {
                throw new EntityNotFoundException(ref);
            }
            viewStore.remove(ref);
            log.warn("Removed materialized row of {} with no event history", ref);
            return new DivergenceReport(ref, live.get().getVersion(), 0L, List.of("row without events"), true);
        }

        EntityState replayed = replayer.replay(EntityState.empty(ref), events);
        List<String> differences = diff(live.orElse(null), replayed);
        viewStore.persist(replayed);

        if (differences.isEmpty()) {
            log.info("Rebuilt {} at version {}; no divergence", ref, replayed.getVersion());
        } else {
            log.warn("Rebuilt {} at version {}; repaired {}", ref, replayed.getVersion(), differences);
            metrics.recordDivergence(ref.type().wireName(), true);
        }
        return new DivergenceReport(ref, live.map(EntityState::getVersion).orElse(0L),
                replayed.getVersion(), differences, true);
    }

    static List<String> diff(EntityState live, EntityState replayed) {
        List<String> differences = new ArrayList<>();
        if (live == null) {
            differences.add("row missing");
            return differences;
        }
        compare(differences, "version", live.getVersion(), replayed.getVersion());
        compare(differences, "status", live.getStatus(), replayed.getStatus());
        compare(differences, "fields", live.getFields(), replayed.getFields());
        compare(differences, "identifiers", live.getIdentifiers(), replayed.getIdentifiers());
        compare(differences, "contactMethods", live.getContactMethods(), replayed.getContactMethods());
        compare(differences, "affiliations", live.getAffiliations(), replayed.getAffiliations());
        compare(differences, "provenance", live.getProvenance(), replayed.getProvenance());
        compare(differences, "mergedInto", live.getMergedInto(), replayed.getMergedInto());
        compare(differences, "absorbedEntityIds", live.getAbsorbedEntityIds(), replayed.getAbsorbedEntityIds());
        compare(differences, "splitFrom", live.getSplitFrom(), replayed.getSplitFrom());
        compare(differences, "createdAt", live.getCreatedAt(), replayed.getCreatedAt());
        compare(differences, "updatedAt", live.getUpdatedAt(), replayed.getUpdatedAt());
        return differences;
    }

    private static void compare(List<String> differences, String attribute, Object live, Object replayed) {
        if (!Objects.equals(live, replayed)) {
            differences.add(attribute);
        }
    }
}
