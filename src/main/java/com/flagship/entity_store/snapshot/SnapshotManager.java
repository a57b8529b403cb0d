package com.flagship.entity_store.snapshot;

import com.flagship.entity_store.entity.EntityRef;
import com.flagship.entity_store.entity.EntityState;
import com.flagship.entity_store.entity.exception.EntityNotFoundException;
import com.flagship.entity_store.event.EventLog;
import com.flagship.entity_store.event.SequenceAllocator;
import com.flagship.entity_store.event.StoredEvent;
import com.flagship.entity_store.observability.EntityStoreMetrics;
import com.flagship.entity_store.reconstruct.PointInTimeReconstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Takes snapshots out of band, never inside a write transaction. The fold runs without
 * locks; only the final insert (plus pruning of superseded ones) holds the entity's
 * write lock, and it is skipped when the folded event is gone by then, so a
 * compliance erasure that commits mid-fold is never undone by a late snapshot.
 *
 * The state is folded from the previous snapshot plus committed events up to the
 * latest sequence, not copied from the materialized row, so a snapshot always
 * matches a real event. Writes landing meanwhile simply follow the snapshot's
 * sequence and are replayed on top of it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotManager {

    private final SnapshotRepository snapshotRepository;
    private final EventLog eventLog;
    private final SequenceAllocator sequenceAllocator;
    private final PointInTimeReconstructor reconstructor;
    private final EntityStoreMetrics metrics;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    @Value("${entity-store.snapshot.threshold:50}")
    private int threshold;

    @Value("${entity-store.snapshot.retain:3}")
    private int retain;

    /**
     * Snapshots the entity if more than the threshold of events accumulated since
     * its latest snapshot.
     */
    public Optional<Snapshot> maybeSnapshot(EntityRef ref) {
        long latest = eventLog.latestSequence(ref);
        long lastSnapshot = snapshotRepository.findLatest(ref).map(Snapshot::getAsOfSequence).orElse(0L);
        if (latest - lastSnapshot <= threshold) {
            return Optional.empty();
        }
        return Optional.of(takeSnapshot(ref));
    }

    /**
     * Snapshots the entity at its latest committed sequence regardless of threshold.
     *
     * @throws EntityNotFoundException if the entity has no events, including when it
     *                                 was erased while the state was being folded
     */
    public Snapshot takeSnapshot(EntityRef ref) {
        long latest = eventLog.latestSequence(ref);
        if (latest == 0) {
            throw new EntityNotFoundException(ref);
        }
        StoredEvent asOf = eventLog.findBySequence(ref, latest)
            .orElseThrow(() -> new EntityNotFoundException(ref));
        EntityState state = reconstructor.stateAtSequence(ref, latest);

        Snapshot snapshot = new Snapshot(UUID.randomUUID(), ref, latest, asOf.getOccurredAt(), state, clock.instant());
        Boolean saved = transactionTemplate.execute(status -> saveIfStillRecorded(snapshot, asOf));
        if (saved == null) {
            log.info("{} was erased while its snapshot at #{} was being taken; discarded", ref, latest);
            throw new EntityNotFoundException(ref);
        }
        if (saved) {
            int pruned = snapshotRepository.prune(ref, Math.max(1, retain));
            metrics.recordSnapshotTaken(ref.type().wireName());
            log.info("Snapshot of {} taken at #{} (pruned {})", ref, latest, pruned);
        }
        return snapshot;
    }

    /**
     * Inserts under the entity's write lock, which erasure takes too. Null when the
     * folded event no longer exists.
     */
    private Boolean saveIfStillRecorded(Snapshot snapshot, StoredEvent asOf) {
        EntityRef ref = snapshot.getRef();
        if (!sequenceAllocator.lock(ref)) {
            return null;
        }
        boolean recorded = eventLog.findBySequence(ref, snapshot.getAsOfSequence())
            .filter(event -> event.getId().equals(asOf.getId()))
            .isPresent();
        if (!recorded) {
            return null;
        }
        boolean covered = snapshotRepository.findLatest(ref)
            .filter(latest -> latest.getAsOfSequence() >= snapshot.getAsOfSequence())
            .isPresent();
        return !covered && snapshotRepository.save(snapshot);
    }

    @Transactional(readOnly = true)
    public List<Snapshot> listSnapshots(EntityRef ref) {
        return snapshotRepository.findAll(ref);
    }

    /**
     * Drops every snapshot of an entity. Reconstruction results stay the same.
     */
    @Transactional
    public int deleteSnapshots(EntityRef ref) {
        int deleted = snapshotRepository.deleteAll(ref);
        log.info("Deleted {} snapshots of {}", deleted, ref);
        return deleted;
    }
}
