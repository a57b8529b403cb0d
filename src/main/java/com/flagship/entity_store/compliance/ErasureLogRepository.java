package com.flagship.entity_store.compliance;

import com.flagship.entity_store.entity.EntityRef;
import com.flagship.entity_store.entity.EntityType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class ErasureLogRepository {

    private static final String COLUMNS =
        "id, entity_type, entity_id, events_deleted, snapshots_deleted, requested_by, reason, erased_at";

    private static final RowMapper<ErasureRecord> ROW_MAPPER = (rs, rowNum) -> new ErasureRecord(
        UUID.fromString(rs.getString("id")),
        EntityRef.of(EntityType.fromWireName(rs.getString("entity_type")), UUID.fromString(rs.getString("entity_id"))),
        rs.getInt("events_deleted"),
        rs.getInt("snapshots_deleted"),
        rs.getString("requested_by"),
        rs.getString("reason"),
        rs.getTimestamp("erased_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public void insert(ErasureRecord record) {
        jdbcTemplate.update(
            "INSERT INTO erasure_log (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
            record.getId(),
            record.getRef().type().wireName(),
            record.getRef().id(),
            record.getEventsDeleted(),
            record.getSnapshotsDeleted(),
            record.getRequestedBy(),
            record.getReason(),
            Timestamp.from(record.getErasedAt())
        );
    }

    public List<ErasureRecord> findByEntity(EntityRef ref) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM erasure_log WHERE entity_type = ? AND entity_id = ? ORDER BY erased_at",
            ROW_MAPPER, ref.type().wireName(), ref.id()
        );
    }
}
