package com.flagship.entity_store.projection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.entity_store.entity.Affiliation;
import com.flagship.entity_store.entity.EntityRef;
import com.flagship.entity_store.entity.EntityState;
import com.flagship.entity_store.entity.EntityType;
import com.flagship.entity_store.entity.Identifier;
import com.flagship.entity_store.entity.ProvenanceRecord;
import com.flagship.entity_store.entity.exception.ReplayGapException;
import com.flagship.entity_store.event.StoredEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Current-state projection of every entity.
 *
 * One row per entity in entity_views holds the full projected state as JSON plus the
 * columns listings filter and sort on. entity_identifiers, entity_affiliations and
 * entity_provenance are derived lookup tables rewritten with the row.
 *
 * Writes happen only through {@link #applyAndPersist(EntityState, StoredEvent)} in the
 * transaction that appended the event, or through a rebuild from the log. Either both
 * the event and the row change, or neither does.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class MaterializedViewStore {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final EventHandlerRegistry registry;

    public Optional<EntityState> load(EntityRef ref) {
        return jdbcTemplate.query(
            "SELECT state_json FROM entity_views WHERE entity_type = ? AND entity_id = ?",
            (rs, rowNum) -> readState(rs.getString("state_json")),
            ref.type().wireName(), ref.id()
        ).stream().findFirst();
    }

    public EntityState loadOrEmpty(EntityRef ref) {
        return load(ref).orElseGet(() -> EntityState.empty(ref));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public EntityState applyAndPersist(StoredEvent event) {
        return applyAndPersist(loadOrEmpty(event.getEntityRef()), event);
    }

    /**
     * Folds a freshly appended event onto the current row and writes the result.
     *
     * @throws ReplayGapException if the event does not directly follow the row's version
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public EntityState applyAndPersist(EntityState current, StoredEvent event) {
        if (event.getSequence() != current.getVersion() + 1) {
            throw new ReplayGapException(event.getEntityRef(), current.getVersion() + 1, event.getSequence());
        }
        EntityState next = registry.apply(current, event);
        persist(next);
        return next;
    }

    /**
     * Writes a whole state, replacing the row and its lookup rows.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void persist(EntityState state) {
        EntityRef ref = state.getRef();
        String json = writeState(state);

        int updated = jdbcTemplate.update(
            "UPDATE entity_views SET status = ?, display_name = ?, last_seq = ?, state_json = ?, " +
            "created_at = ?, updated_at = ? WHERE entity_type = ? AND entity_id = ?",
            state.getStatus().name(), state.getDisplayName(), state.getVersion(), json,
            timestamp(state.getCreatedAt()), timestamp(state.getUpdatedAt()),
            ref.type().wireName(), ref.id()
        );
        if (updated == 0) {
            jdbcTemplate.update(
                "INSERT INTO entity_views (entity_type, entity_id, status, display_name, last_seq, state_json, " +
                "created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                ref.type().wireName(), ref.id(), state.getStatus().name(), state.getDisplayName(),
                state.getVersion(), json, timestamp(state.getCreatedAt()), timestamp(state.getUpdatedAt())
            );
        }

        deleteLookups(ref);
        for (Identifier identifier : state.getIdentifiers()) {
            jdbcTemplate.update(
                "INSERT INTO entity_identifiers (entity_type, entity_id, item_id, identifier_type, " +
                "identifier_value, origin_entity_id) VALUES (?, ?, ?, ?, ?, ?)",
                ref.type().wireName(), ref.id(), identifier.getId(), normalize(identifier.getType()),
                normalize(identifier.getValue()), identifier.getOriginEntityId()
            );
        }
        for (Affiliation affiliation : state.getAffiliations()) {
            jdbcTemplate.update(
                "INSERT INTO entity_affiliations (entity_type, entity_id, item_id, organization_type, " +
                "organization_id) VALUES (?, ?, ?, ?, ?)",
                ref.type().wireName(), ref.id(), affiliation.getId(),
                affiliation.getOrganization().type().wireName(), affiliation.getOrganization().id()
            );
        }
        for (ProvenanceRecord record : state.getProvenance()) {
            jdbcTemplate.update(
                "INSERT INTO entity_provenance (entity_type, entity_id, record_id, source, source_id, " +
                "origin_entity_id, recorded_at) VALUES (?, ?, ?, ?, ?, ?, ?)",
                ref.type().wireName(), ref.id(), record.getId(), record.getSource(), record.getSourceId(),
                record.getOriginEntityId(), timestamp(record.getRecordedAt())
            );
        }
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public int remove(EntityRef ref) {
        deleteLookups(ref);
        return jdbcTemplate.update(
            "DELETE FROM entity_views WHERE entity_type = ? AND entity_id = ?",
            ref.type().wireName(), ref.id()
        );
    }

    /**
     * Listable (active) entities of a type, by display name.
     */
    public List<EntityState> list(EntityType type, int limit, int offset) {
        return jdbcTemplate.query(
            "SELECT state_json FROM entity_views WHERE entity_type = ? AND status = 'ACTIVE' " +
            "ORDER BY display_name, entity_id LIMIT ? OFFSET ?",
            (rs, rowNum) -> readState(rs.getString("state_json")),
            type.wireName(), limit, offset
        );
    }

    public long countListable(EntityType type) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM entity_views WHERE entity_type = ? AND status = 'ACTIVE'",
            Long.class, type.wireName()
        );
        return count != null ? count : 0L;
    }

    /**
     * Active entities holding an identifier. Matching ignores case.
     */
    public List<EntityRef> findByIdentifier(EntityType type, String identifierType, String value) {
        return jdbcTemplate.query(
            "SELECT DISTINCT i.entity_id FROM entity_identifiers i " +
            "JOIN entity_views v ON v.entity_type = i.entity_type AND v.entity_id = i.entity_id " +
            "WHERE i.entity_type = ? AND i.identifier_type = ? AND i.identifier_value = ? AND v.status = 'ACTIVE'",
            (rs, rowNum) -> EntityRef.of(type, UUID.fromString(rs.getString("entity_id"))),
            type.wireName(), normalize(identifierType), normalize(value)
        );
    }

    /**
     * Active entities with at least one affiliation, current or ended, that points at
     * the organization.
     */
    public List<EntityRef> findAffiliatedWith(EntityRef organization) {
        return jdbcTemplate.query(
            "SELECT DISTINCT a.entity_type, a.entity_id FROM entity_affiliations a " +
            "JOIN entity_views v ON v.entity_type = a.entity_type AND v.entity_id = a.entity_id " +
            "WHERE a.organization_type = ? AND a.organization_id = ? AND v.status = 'ACTIVE'",
            (rs, rowNum) -> EntityRef.of(
                EntityType.fromWireName(rs.getString("entity_type")),
                UUID.fromString(rs.getString("entity_id"))),
            organization.type().wireName(), organization.id()
        );
    }

    /**
     * Random sample of materialized entities, for background verification.
     */
    public List<EntityRef> sample(int limit) {
        return jdbcTemplate.query(
            "SELECT entity_type, entity_id FROM entity_views ORDER BY RANDOM() LIMIT ?",
            (rs, rowNum) -> EntityRef.of(
                EntityType.fromWireName(rs.getString("entity_type")),
                UUID.fromString(rs.getString("entity_id"))),
            limit
        );
    }

    private void deleteLookups(EntityRef ref) {
        jdbcTemplate.update("DELETE FROM entity_identifiers WHERE entity_type = ? AND entity_id = ?",
            ref.type().wireName(), ref.id());
        jdbcTemplate.update("DELETE FROM entity_affiliations WHERE entity_type = ? AND entity_id = ?",
            ref.type().wireName(), ref.id());
        jdbcTemplate.update("DELETE FROM entity_provenance WHERE entity_type = ? AND entity_id = ?",
            ref.type().wireName(), ref.id());
    }

    private String writeState(EntityState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize state of " + state.getRef(), e);
        }
    }

    private EntityState readState(String json) {
        try {
            return objectMapper.readValue(json, EntityState.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable materialized state", e);
        }
    }

    private static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static String normalize(String value) {
        return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
    }
}
