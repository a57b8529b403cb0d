package com.flagship.entity_store.event;

import com.flagship.entity_store.entity.EntityRef;
import com.flagship.entity_store.entity.EntityType;
import com.flagship.entity_store.entity.exception.OrderingConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only store of events, keyed by (entity type, entity id, sequence).
 *
 * The table's unique constraints reject a second event with the same sequence or the
 * same dedup key for an entity. Rows are never updated; the only delete is
 * {@link #deleteAll(EntityRef)} for compliance erasure.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class EventLog {

    private static final String COLUMNS =
        "id, entity_type, entity_id, seq_no, event_type, payload, actor_id, occurred_at, dedup_key";

    private final JdbcTemplate jdbcTemplate;

    /**
     * Appends an event inside the caller's transaction.
     *
     * @throws OrderingConflictException if the sequence or dedup key is already taken
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public UUID append(StoredEvent event) {
        try {
            jdbcTemplate.update(
                "INSERT INTO entity_events (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                event.getId(),
                event.getEntityType().wireName(),
                event.getEntityId(),
                event.getSequence(),
                event.getEventType(),
                event.getPayload(),
                event.getActorId(),
                Timestamp.from(event.getOccurredAt()),
                event.getDedupKey()
            );
        } catch (DuplicateKeyException e) {
            throw new OrderingConflictException(event.getEntityRef(),
                String.format("Event slot %d of %s already taken", event.getSequence(), event.getEntityRef()), e);
        }
        log.debug("Appended {} #{} to {}", event.getEventType(), event.getSequence(), event.getEntityRef());
        return event.getId();
    }

    /**
     * Events with sequence above {@code fromSequenceExclusive} and occurredAt at or
     * before {@code toTimestampInclusive}, in ascending sequence order.
     */
    public List<StoredEvent> readRange(EntityRef ref, long fromSequenceExclusive, Instant toTimestampInclusive) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM entity_events " +
            "WHERE entity_type = ? AND entity_id = ? AND seq_no > ? AND occurred_at <= ? " +
            "ORDER BY seq_no ASC",
            eventRowMapper(),
            ref.type().wireName(), ref.id(), fromSequenceExclusive, Timestamp.from(toTimestampInclusive)
        );
    }

    /**
     * Events with sequence in (fromSequenceExclusive, toSequenceInclusive].
     */
    public List<StoredEvent> readBetween(EntityRef ref, long fromSequenceExclusive, long toSequenceInclusive) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM entity_events " +
            "WHERE entity_type = ? AND entity_id = ? AND seq_no > ? AND seq_no <= ? " +
            "ORDER BY seq_no ASC",
            eventRowMapper(),
            ref.type().wireName(), ref.id(), fromSequenceExclusive, toSequenceInclusive
        );
    }

    public List<StoredEvent> readAfter(EntityRef ref, long fromSequenceExclusive) {
        return readBetween(ref, fromSequenceExclusive, Long.MAX_VALUE);
    }

    public List<StoredEvent> readAll(EntityRef ref) {
        return readAfter(ref, 0L);
    }

    public Optional<StoredEvent> findById(UUID eventId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM entity_events WHERE id = ?",
            eventRowMapper(), eventId
        ).stream().findFirst();
    }

    public Optional<StoredEvent> findBySequence(EntityRef ref, long sequence) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM entity_events WHERE entity_type = ? AND entity_id = ? AND seq_no = ?",
            eventRowMapper(), ref.type().wireName(), ref.id(), sequence
        ).stream().findFirst();
    }

    public Optional<StoredEvent> findByDedupKey(EntityRef ref, String dedupKey) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM entity_events WHERE entity_type = ? AND entity_id = ? AND dedup_key = ?",
            eventRowMapper(), ref.type().wireName(), ref.id(), dedupKey
        ).stream().findFirst();
    }

    /**
     * Highest committed sequence for an entity; 0 if it has no events.
     */
    public long latestSequence(EntityRef ref) {
        Long max = jdbcTemplate.queryForObject(
            "SELECT MAX(seq_no) FROM entity_events WHERE entity_type = ? AND entity_id = ?",
            Long.class, ref.type().wireName(), ref.id()
        );
        return max != null ? max : 0L;
    }

    public long count(EntityRef ref) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM entity_events WHERE entity_type = ? AND entity_id = ?",
            Long.class, ref.type().wireName(), ref.id()
        );
        return count != null ? count : 0L;
    }

    /**
     * Hard-deletes an entity's history. Compliance erasure only.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int deleteAll(EntityRef ref) {
        return jdbcTemplate.update(
            "DELETE FROM entity_events WHERE entity_type = ? AND entity_id = ?",
            ref.type().wireName(), ref.id()
        );
    }

    private RowMapper<StoredEvent> eventRowMapper() {
        return (rs, rowNum) -> StoredEvent.builder()
            .id(UUID.fromString(rs.getString("id")))
            .entityType(EntityType.fromWireName(rs.getString("entity_type")))
            .entityId(UUID.fromString(rs.getString("entity_id")))
            .sequence(rs.getLong("seq_no"))
            .eventType(rs.getString("event_type"))
            .payload(rs.getString("payload"))
            .actorId(rs.getString("actor_id"))
            .occurredAt(rs.getTimestamp("occurred_at").toInstant())
            .dedupKey(rs.getString("dedup_key"))
            .build();
    }
}
