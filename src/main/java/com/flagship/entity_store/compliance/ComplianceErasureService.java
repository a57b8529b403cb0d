package com.flagship.entity_store.compliance;

import com.flagship.entity_store.entity.EntityRef;
import com.flagship.entity_store.entity.exception.EntityNotFoundException;
import com.flagship.entity_store.event.EventLog;
import com.flagship.entity_store.event.EventType;
import com.flagship.entity_store.event.SequenceAllocator;
import com.flagship.entity_store.merge.MatchCandidatePersistenceService;
import com.flagship.entity_store.observability.CorrelationContext;
import com.flagship.entity_store.observability.EntityStoreMetrics;
import com.flagship.entity_store.outbox.EntityEventMessage;
import com.flagship.entity_store.outbox.OutboxService;
import com.flagship.entity_store.projection.MaterializedViewStore;
import com.flagship.entity_store.snapshot.SnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Hard delete of everything the store holds about one entity.
 *
 * This is the only path that removes events. In one transaction it deletes the
 * entity's events, snapshots, materialized row, lookups, sequence counter and queued
 * relay messages, nulls match-candidate and merge-record references to it, and writes
 * a metadata-only erasure log entry. The graph mirror is told through a Deleted
 * message flagged as erased that carries no payload.
 *
 * Data an erased entity contributed to a survivor through an earlier merge belongs to
 * the survivor's history and is not touched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ComplianceErasureService {

    private final SequenceAllocator sequenceAllocator;
    private final EventLog eventLog;
    private final SnapshotRepository snapshotRepository;
    private final MaterializedViewStore viewStore;
    private final OutboxService outboxService;
    private final MatchCandidatePersistenceService candidatePersistence;
    private final ErasureLogRepository erasureLogRepository;
    private final EntityStoreMetrics metrics;
    private final Clock clock;

    @Transactional
    public ErasureRecord erase(EntityRef ref, String requestedBy, String reason) {
        try (MDC.MDCCloseable ignored = CorrelationContext.withEntity(ref)) {
            boolean known = sequenceAllocator.lock(ref);
            if (!known && viewStore.load(ref).isEmpty()) {
                throw new EntityNotFoundException(ref);
            }

            int events = eventLog.deleteAll(ref);
            int snapshots = snapshotRepository.deleteAll(ref);
            viewStore.remove(ref);
            int relayMessages = outboxService.deleteEventsForEntity(ref);
            sequenceAllocator.delete(ref);
            int references = candidatePersistence.clearReferences(ref.id());

            Instant now = clock.instant();
            ErasureRecord record = new ErasureRecord(UUID.randomUUID(), ref, events, snapshots, requestedBy,
                reason, now);
            erasureLogRepository.insert(record);

            outboxService.saveEvent(ref, EventType.DELETED.wireName(),
                EntityEventMessage.builder()
                    .eventId(record.getId())
                    .entityType(ref.type().wireName())
                    .entityId(ref.id())
                    .eventType(EventType.DELETED.wireName())
                    .actorId(requestedBy)
                    .occurredAt(now)
                    .erased(true)
                    .build());

            metrics.recordErasure(ref.type().wireName());
            log.warn("Erased {}: events={}, snapshots={}, relayMessages={}, references={}, requestedBy={}",
                ref, events, snapshots, relayMessages, references, requestedBy);
            return record;
        }
    }

    @Transactional(readOnly = true)
    public List<ErasureRecord> history(EntityRef ref) {
        return erasureLogRepository.findByEntity(ref);
    }
}
