package com.flagship.entity_store.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Projected state of one entity: the result of folding its events in sequence order.
 *
 * Immutable. Handlers produce a new instance per event via {@link #toBuilder()}.
 * The same shape is stored in the materialized view, serialized into snapshots and
 * returned by point-in-time reconstruction.
 *
 * A state with a null status is the empty state: no event has been folded yet.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class EntityState {

    EntityRef ref;
    EntityStatus status;

    /**
     * Sequence of the last event folded into this state; 0 for the empty state.
     */
    long version;

    @Builder.Default
    Map<String, String> fields = Map.of();

    @Builder.Default
    List<Identifier> identifiers = List.of();

    @Builder.Default
    List<ContactMethod> contactMethods = List.of();

    @Builder.Default
    List<Affiliation> affiliations = List.of();

    @Builder.Default
    List<ProvenanceRecord> provenance = List.of();

    /**
     * Survivor id once this entity has been absorbed by a merge.
     */
    UUID mergedInto;

    /**
     * Entities merged into this one and not split off since.
     */
    @Builder.Default
    List<UUID> absorbedEntityIds = List.of();

    /**
     * Entity this one was split out of, when created by a split.
     */
    UUID splitFrom;

    Instant createdAt;
    Instant updatedAt;

    public static EntityState empty(EntityRef ref) {
        return EntityState.builder().ref(ref).build();
    }

    public boolean exists() {
        return status != null;
    }

    @JsonIgnore
    public boolean isActive() {
        return status == EntityStatus.ACTIVE;
    }

    /**
     * Listing name: "name" for companies, "first_name last_name" or "name" for contacts.
     */
    @JsonIgnore
    public String getDisplayName() {
        String name = fields.get("name");
        if (name != null && !name.isBlank()) {
            return name;
        }
        String first = fields.getOrDefault("first_name", "");
        String last = fields.getOrDefault("last_name", "");
        String combined = (first + " " + last).trim();
        return combined.isEmpty() ? null : combined;
    }
}
