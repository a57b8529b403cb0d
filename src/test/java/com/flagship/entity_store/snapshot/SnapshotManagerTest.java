package com.flagship.entity_store.snapshot;

import com.flagship.entity_store.EntityStoreTestSupport;
import com.flagship.entity_store.compliance.ComplianceErasureService;
import com.flagship.entity_store.entity.EntityRef;
import com.flagship.entity_store.entity.EntityState;
import com.flagship.entity_store.entity.exception.EntityNotFoundException;
import com.flagship.entity_store.entity.exception.ReplayGapException;
import com.flagship.entity_store.reconstruct.PointInTimeReconstructor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.test.util.AopTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;

class SnapshotManagerTest extends EntityStoreTestSupport {

    @Autowired
    private SnapshotManager snapshotManager;

    @Autowired
    private SnapshotRepository snapshotRepository;

    @SpyBean
    private PointInTimeReconstructor reconstructor;

    @Autowired
    private ComplianceErasureService erasureService;

    private EntityRef contactWithUpdates(int updates) {
        EntityRef ref = createContact("Ada", "Lovelace");
        for (int i = 1; i <= updates; i++) {
            entityEventService.updateFields(ref, Map.of("counter", String.valueOf(i)), null, "test");
        }
        return ref;
    }

    @Nested
    @DisplayName("Taking snapshots")
    class Taking {

        @Test
        @DisplayName("A snapshot captures the state at the latest event")
        void snapshotAtLatest() {
            EntityRef ref = contactWithUpdates(4);

            Snapshot snapshot = snapshotManager.takeSnapshot(ref);

            assertEquals(5, snapshot.getAsOfSequence());
            assertEquals("4", snapshot.getState().getFields().get("counter"));
            assertEquals(entityEventService.getState(ref), snapshot.getState());
            assertEquals(1, snapshotManager.listSnapshots(ref).size());
        }

        @Test
        @DisplayName("Only entities past the threshold get an automatic snapshot")
        void thresholdGatesAutomaticSnapshots() {
            EntityRef quiet = contactWithUpdates(3);
            EntityRef busy = contactWithUpdates(55);

            assertEquals(Optional.empty(), snapshotManager.maybeSnapshot(quiet));
            assertEquals(List.of(busy), snapshotRepository.findDueForSnapshot(50, 10));

            Optional<Snapshot> taken = snapshotManager.maybeSnapshot(busy);
            assertTrue(taken.isPresent());
            assertEquals(56, taken.get().getAsOfSequence());
            assertTrue(snapshotRepository.findDueForSnapshot(50, 10).isEmpty());
        }

        @Test
        @DisplayName("Older snapshots beyond the retention count are pruned")
        void pruning() {
            EntityRef ref = createContact("Ada", "Lovelace");
            for (int i = 1; i <= 5; i++) {
                entityEventService.updateFields(ref, Map.of("counter", String.valueOf(i)), null, "test");
                snapshotManager.takeSnapshot(ref);
            }

            List<Long> kept = snapshotManager.listSnapshots(ref).stream().map(Snapshot::getAsOfSequence).toList();
            assertEquals(3, kept.size());
            assertTrue(kept.containsAll(List.of(4L, 5L, 6L)));
        }

        @Test
        @DisplayName("An entity without events cannot be snapshotted")
        void unknownEntity() {
            assertThrows(EntityNotFoundException.class,
                () -> snapshotManager.takeSnapshot(EntityRef.contact(UUID.randomUUID())));
        }
    }

    @Nested
    @DisplayName("Racing a compliance erasure")
    class RacingErasure {

        @Test
        @DisplayName("An erasure committed while the state is folded leaves no snapshot behind")
        void erasureDuringFold() {
            EntityRef ref = contactWithUpdates(3);
            PointInTimeReconstructor target = AopTestUtils.getUltimateTargetObject(reconstructor);
            doAnswer(invocation -> {
                Object folded = invocation.callRealMethod();
                CompletableFuture.runAsync(() -> erasureService.erase(ref, "dpo", "subject request")).join();
                return folded;
            }).when(target).stateAtSequence(eq(ref), anyLong());

            assertThrows(EntityNotFoundException.class, () -> snapshotManager.takeSnapshot(ref));

            assertTrue(snapshotRepository.findAll(ref).isEmpty());
            assertEquals(0, jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM entity_snapshots WHERE entity_id = ?", Integer.class, ref.id()));
            assertEquals(0, jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM entity_events WHERE entity_id = ?", Integer.class, ref.id()));
        }

        @Test
        @DisplayName("A snapshot taken before the erasure is removed by it")
        void snapshotBeforeErasure() {
            EntityRef ref = contactWithUpdates(3);
            snapshotManager.takeSnapshot(ref);

            erasureService.erase(ref, "dpo", "subject request");

            assertTrue(snapshotRepository.findAll(ref).isEmpty());
        }
    }

    @Nested
    @DisplayName("Reading through snapshots")
    class Reading {

        @Test
        @DisplayName("Reconstruction from a snapshot equals replay from the first event")
        void snapshotsAreTransparent() {
            EntityRef ref = contactWithUpdates(6);
            snapshotManager.takeSnapshot(ref);
            entityEventService.updateFields(ref, Map.of("title", "Countess"), null, "test");
            entityEventService.updateFields(ref, Map.of(), List.of("counter"), "test");

            Instant now = Instant.now().plusSeconds(60);
            EntityState viaSnapshot = reconstructor.stateAsOf(ref, now);
            EntityState fromScratch = reconstructor.replayFromScratch(ref, now);

            assertEquals(fromScratch, viaSnapshot);
            assertEquals(9, viaSnapshot.getVersion());
            assertEquals(entityEventService.getState(ref), viaSnapshot);
        }

        @Test
        @DisplayName("A snapshot whose event was lost is a replay gap, not a silent fallback")
        void snapshotOverMissingEvent() {
            EntityRef ref = contactWithUpdates(3);
            snapshotManager.takeSnapshot(ref);
            jdbcTemplate.update("DELETE FROM entity_events WHERE entity_id = ? AND seq_no = 4", ref.id());

            assertThrows(ReplayGapException.class, () -> reconstructor.stateAsOf(ref, Instant.now().plusSeconds(60)));
        }

        @Test
        @DisplayName("A hole in the log between snapshot and target is a replay gap")
        void holeAfterSnapshot() {
            EntityRef ref = contactWithUpdates(5);
            snapshotManager.takeSnapshot(ref);
            entityEventService.updateFields(ref, Map.of("x", "1"), null, "test");
            entityEventService.updateFields(ref, Map.of("x", "2"), null, "test");
            jdbcTemplate.update("DELETE FROM entity_events WHERE entity_id = ? AND seq_no = 7", ref.id());

            ReplayGapException gap = assertThrows(ReplayGapException.class,
                () -> reconstructor.stateAsOf(ref, Instant.now().plusSeconds(60)));
            assertEquals(7, gap.getExpectedSequence());
            assertEquals(8, gap.getFoundSequence());
        }
    }
}
