package com.flagship.entity_store.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.entity_store.entity.EntityRef;
import com.flagship.entity_store.entity.EntityState;
import com.flagship.entity_store.entity.EntityType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to entity_snapshots. Snapshots are inserted and deleted, never updated.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class SnapshotRepository {

    private static final String COLUMNS =
        "id, entity_type, entity_id, as_of_seq, as_of_occurred_at, state_json, taken_at";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    /**
     * @return false if a snapshot at the same sequence already exists
     */
    public boolean save(Snapshot snapshot) {
        try {
            jdbcTemplate.update(
                "INSERT INTO entity_snapshots (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)",
                snapshot.getId(),
                snapshot.getRef().type().wireName(),
                snapshot.getRef().id(),
                snapshot.getAsOfSequence(),
                Timestamp.from(snapshot.getAsOfOccurredAt()),
                writeState(snapshot.getState()),
                Timestamp.from(snapshot.getTakenAt())
            );
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("Snapshot of {} at #{} already exists", snapshot.getRef(), snapshot.getAsOfSequence());
            return false;
        }
    }

    public Optional<Snapshot> findLatest(EntityRef ref) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM entity_snapshots WHERE entity_type = ? AND entity_id = ? " +
            "ORDER BY as_of_seq DESC LIMIT 1",
            snapshotRowMapper(), ref.type().wireName(), ref.id()
        ).stream().findFirst();
    }

    /**
     * Latest snapshot whose last folded event occurred at or before the given time.
     */
    public Optional<Snapshot> findLatestAtOrBefore(EntityRef ref, Instant time) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM entity_snapshots " +
            "WHERE entity_type = ? AND entity_id = ? AND as_of_occurred_at <= ? " +
            "ORDER BY as_of_seq DESC LIMIT 1",
            snapshotRowMapper(), ref.type().wireName(), ref.id(), Timestamp.from(time)
        ).stream().findFirst();
    }

    public Optional<Snapshot> findLatestAtOrBeforeSequence(EntityRef ref, long sequence) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM entity_snapshots " +
            "WHERE entity_type = ? AND entity_id = ? AND as_of_seq <= ? " +
            "ORDER BY as_of_seq DESC LIMIT 1",
            snapshotRowMapper(), ref.type().wireName(), ref.id(), sequence
        ).stream().findFirst();
    }

    public List<Snapshot> findAll(EntityRef ref) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM entity_snapshots WHERE entity_type = ? AND entity_id = ? " +
            "ORDER BY as_of_seq DESC",
            snapshotRowMapper(), ref.type().wireName(), ref.id()
        );
    }

    /**
     * Keeps the newest {@code retain} snapshots of an entity and deletes the rest.
     */
    public int prune(EntityRef ref, int retain) {
        List<Long> sequences = jdbcTemplate.queryForList(
            "SELECT as_of_seq FROM entity_snapshots WHERE entity_type = ? AND entity_id = ? " +
            "ORDER BY as_of_seq DESC",
            Long.class, ref.type().wireName(), ref.id()
        );
        if (sequences.size() <= retain) {
            return 0;
        }
        long oldestKept = sequences.get(retain - 1);
        return jdbcTemplate.update(
            "DELETE FROM entity_snapshots WHERE entity_type = ? AND entity_id = ? AND as_of_seq < ?",
            ref.type().wireName(), ref.id(), oldestKept
        );
    }

    public int deleteAll(EntityRef ref) {
        return jdbcTemplate.update(
            "DELETE FROM entity_snapshots WHERE entity_type = ? AND entity_id = ?",
            ref.type().wireName(), ref.id()
        );
    }

    /**
     * Entities whose event count since their latest snapshot exceeds the threshold,
     * furthest behind first.
     */
    public List<EntityRef> findDueForSnapshot(int threshold, int limit) {
        return jdbcTemplate.query(
            "SELECT s.entity_type, s.entity_id FROM entity_sequences s " +
            "LEFT JOIN (SELECT entity_type, entity_id, MAX(as_of_seq) AS max_seq FROM entity_snapshots " +
            "           GROUP BY entity_type, entity_id) sn " +
            "  ON sn.entity_type = s.entity_type AND sn.entity_id = s.entity_id " +
            "WHERE s.last_seq - COALESCE(sn.max_seq, 0) > ? " +
            "ORDER BY s.last_seq - COALESCE(sn.max_seq, 0) DESC LIMIT ?",
            (rs, rowNum) -> EntityRef.of(
                EntityType.fromWireName(rs.getString("entity_type")),
                UUID.fromString(rs.getString("entity_id"))),
            threshold, limit
        );
    }

    private RowMapper<Snapshot> snapshotRowMapper() {
        return (rs, rowNum) -> new Snapshot(
            UUID.fromString(rs.getString("id")),
            EntityRef.of(EntityType.fromWireName(rs.getString("entity_type")),
                UUID.fromString(rs.getString("entity_id"))),
            rs.getLong("as_of_seq"),
            rs.getTimestamp("as_of_occurred_at").toInstant(),
            readState(rs.getString("state_json")),
            rs.getTimestamp("taken_at").toInstant()
        );
    }

    private String writeState(EntityState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize snapshot state of " + state.getRef(), e);
        }
    }

    private EntityState readState(String json) {
        try {
            return objectMapper.readValue(json, EntityState.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable snapshot state", e);
        }
    }
}
