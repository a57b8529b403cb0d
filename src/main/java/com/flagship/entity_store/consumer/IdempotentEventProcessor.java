package com.flagship.entity_store.consumer;

import com.flagship.entity_store.observability.EntityStoreMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Runs a handler at most once per relayed event id.
 *
 * The ledger row is written in the same transaction as the check, after the handler
 * returns. A handler that throws leaves no row, so the redelivered message runs it
 * again. Handlers must therefore tolerate being re-run after a partial failure.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final EntityStoreMetrics metrics;
    private final Clock clock;

    /**
     * @return true if the handler ran, false if the event was already processed
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType, String entityType, UUID entityId,
                                Runnable handler) {
        if (isAlreadyProcessed(eventId)) {
            log.info("Event {} already processed, skipping", eventId);
            metrics.recordEventProcessed(eventType, false);
            return false;
        }

        try {
            handler.run();
        } catch (RuntimeException e) {
            metrics.recordEventProcessingFailure(eventType, e.getClass().getSimpleName());
            log.error("Failed to process event {} ({} on {}:{}): {}", eventId, eventType, entityType, entityId,
                e.getMessage(), e);
            throw e;
        }

        repository.save(ProcessedEventEntity.fromDomain(
            ProcessedEvent.success(eventId, eventType, entityType, entityId, clock.instant())));
        metrics.recordEventProcessed(eventType, true);
        log.debug("Processed event {} ({} on {}:{})", eventId, eventType, entityType, entityId);
        return true;
    }

    @Transactional
    public void skipEvent(UUID eventId, String eventType, String entityType, UUID entityId, String reason) {
        if (isAlreadyProcessed(eventId)) {
            return;
        }
        repository.save(ProcessedEventEntity.fromDomain(
            ProcessedEvent.skipped(eventId, eventType, entityType, entityId, clock.instant(), reason)));
        log.debug("Skipped event {}: {}", eventId, reason);
    }

    public boolean isAlreadyProcessed(UUID eventId) {
        return repository.existsById(eventId);
    }
}
