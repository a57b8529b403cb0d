package com.flagship.entity_store.event;

import com.flagship.entity_store.entity.EntityRef;
import com.flagship.entity_store.entity.exception.OrderingConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Hands out per-entity sequence numbers from a counter row locked for the rest of the
 * caller's transaction.
 *
 * Writers to the same entity queue on the row lock (SELECT ... FOR UPDATE) and each
 * sees the previous writer's committed value, so sequences are strictly increasing
 * without gaps. Writers to different entities touch different rows and never block
 * each other. The first allocation for an entity inserts the row; when two first
 * writers race, the loser hits the primary key and gets an
 * {@link OrderingConflictException} to retry on.
 *
 * The allocated timestamp never goes backwards within an entity, so time-bounded
 * reads select a prefix of the sequence.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SequenceAllocator {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /**
     * Allocates the next sequence for an entity inside the caller's transaction.
     * Nothing is visible to other readers until that transaction commits.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public SequenceAllocation nextSequence(EntityRef ref) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        Optional<SequenceAllocation> current = lockCounter(ref);

        if (current.isEmpty()) {
            try {
                jdbcTemplate.update(
                    "INSERT INTO entity_sequences (entity_type, entity_id, last_seq, last_occurred_at) " +
                    "VALUES (?, ?, 1, ?)",
                    ref.type().wireName(), ref.id(), Timestamp.from(now)
                );
            } catch (DuplicateKeyException e) {
                throw new OrderingConflictException(ref,
                    "Concurrent first write to " + ref, e);
            }
            return new SequenceAllocation(1, now);
        }

        SequenceAllocation last = current.get();
        long next = last.getSequence() + 1;
        Instant occurredAt = now.isBefore(last.getOccurredAt()) ? last.getOccurredAt() : now;

        int updated = jdbcTemplate.update(
            "UPDATE entity_sequences SET last_seq = ?, last_occurred_at = ? " +
            "WHERE entity_type = ? AND entity_id = ? AND last_seq = ?",
            next, Timestamp.from(occurredAt), ref.type().wireName(), ref.id(), last.getSequence()
        );
        if (updated != 1) {
            throw new OrderingConflictException(ref,
                String.format("Sequence %d of %s was taken concurrently", next, ref));
        }
        log.trace("Allocated sequence {} for {}", next, ref);
        return new SequenceAllocation(next, occurredAt);
    }

    /**
     * Takes the entity's write lock without allocating.
     *
     * @return false if the entity has never been written
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean lock(EntityRef ref) {
        return lockCounter(ref).isPresent();
    }

    /**
     * Locks several entities in canonical order so that two multi-entity operations
     * over the same pair cannot deadlock.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void lockAll(Collection<EntityRef> refs) {
        refs.stream().distinct().sorted().forEach(this::lockCounter);
    }

    /**
     * Last committed sequence for an entity; 0 if it has none.
     */
    public long currentSequence(EntityRef ref) {
        List<Long> rows = jdbcTemplate.queryForList(
            "SELECT last_seq FROM entity_sequences WHERE entity_type = ? AND entity_id = ?",
            Long.class, ref.type().wireName(), ref.id()
        );
        return rows.isEmpty() ? 0L : rows.get(0);
    }

    /**
     * Drops the counter row. Only compliance erasure does this.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int delete(EntityRef ref) {
        return jdbcTemplate.update(
            "DELETE FROM entity_sequences WHERE entity_type = ? AND entity_id = ?",
            ref.type().wireName(), ref.id()
        );
    }

    private Optional<SequenceAllocation> lockCounter(EntityRef ref) {
        List<SequenceAllocation> rows = jdbcTemplate.query(
            "SELECT last_seq, last_occurred_at FROM entity_sequences " +
            "WHERE entity_type = ? AND entity_id = ? FOR UPDATE",
            (rs, rowNum) -> new SequenceAllocation(
                rs.getLong("last_seq"),
                rs.getTimestamp("last_occurred_at").toInstant()
            ),
            ref.type().wireName(), ref.id()
        );
        return rows.stream().findFirst();
    }
}
