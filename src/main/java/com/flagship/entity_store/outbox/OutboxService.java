package com.flagship.entity_store.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.entity_store.entity.EntityRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Relay messages for the graph mirror.
 *
 * Messages are written inside the append's transaction and share its fate. The
 * bookkeeping calls used by {@link OutboxPublisher} each run in their own
 * transaction so one failed send does not undo another's progress.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(EntityRef ref, String eventType, EntityEventMessage message) {
        OutboxEvent event = OutboxEvent.pending(ref, eventType, toJson(message), clock.instant());
        OutboxEvent saved = repository.save(OutboxEventEntity.fromDomain(event)).toDomain();
        log.debug("Queued {} for {} (outboxId={})", eventType, ref, saved.getId());
        return saved;
    }

    /**
     * Claims up to {@code limit} messages still below {@code maxRetries} failures.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit, int maxRetries) {
        return repository.claimUnpublished(limit, maxRetries).stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID outboxId) {
        repository.findById(outboxId).ifPresent(entity -> {
            entity.markPublished(clock.instant());
            log.debug("Relayed outbox message {}", outboxId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID outboxId, String error) {
        repository.findById(outboxId).ifPresent(entity -> {
            entity.markFailed(error);
            log.warn("Relay of outbox message {} failed (attempt {}): {}", outboxId, entity.getRetryCount(), error);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForEntity(EntityRef ref) {
        return repository.findByEntityTypeAndEntityIdOrderBySequenceNumberAsc(ref.type().wireName(), ref.id())
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public int deleteEventsForEntity(EntityRef ref) {
        return repository.deleteForEntity(ref.type().wireName(), ref.id());
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countByPublishedAtIsNull();
    }

    private String toJson(EntityEventMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize relay message " + message.getEventId(), e);
        }
    }
}
