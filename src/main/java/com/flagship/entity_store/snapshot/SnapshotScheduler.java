package com.flagship.entity_store.snapshot;

import com.flagship.entity_store.entity.EntityRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Background sweep that snapshots entities whose replay tail grew past the threshold.
 */
@Component
@ConditionalOnProperty(name = "entity-store.snapshot.scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SnapshotScheduler {

    private final SnapshotRepository snapshotRepository;
    private final SnapshotManager snapshotManager;

    @Value("${entity-store.snapshot.threshold:50}")
    private int threshold;

    @Value("${entity-store.snapshot.scheduler.batch-size:100}")
    private int batchSize;

    @Scheduled(fixedDelayString = "${entity-store.snapshot.scheduler.interval-ms:60000}")
    public void snapshotDueEntities() {
        List<EntityRef> due = snapshotRepository.findDueForSnapshot(threshold, batchSize);
        if (due.isEmpty()) {
            return;
        }
        int taken = 0;
        for (EntityRef ref : due) {
            try {
                if (snapshotManager.maybeSnapshot(ref).isPresent()) {
                    taken++;
                }
            } catch (Exception e) {
                log.error("Snapshot of {} failed: {}", ref, e.getMessage());
            }
        }
        log.info("Snapshot sweep: {} due, {} taken", due.size(), taken);
    }
}
