package com.flagship.entity_store.event.payload;

import com.flagship.entity_store.entity.Affiliation;
import com.flagship.entity_store.entity.ContactMethod;
import com.flagship.entity_store.entity.Identifier;
import com.flagship.entity_store.entity.ProvenanceRecord;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Appended to both sides of a merge.
 *
 * The survivor's copy carries the items moved over from the absorbed entity and any
 * field overrides chosen by the reviewer. The absorbed entity's copy carries only the
 * counterpart and the match evidence; its items are implied by its own history.
 */
@Value
@Builder
@Jacksonized
public class EntityMerged implements EventPayload {

    MergeRole role;
    UUID counterpartId;
    UUID candidateId;
    double confidence;

    @Builder.Default
    Map<String, Double> signals = Map.of();

    @Builder.Default
    List<Identifier> identifiers = List.of();

    @Builder.Default
    List<ContactMethod> contactMethods = List.of();

    @Builder.Default
    List<Affiliation> affiliations = List.of();

    @Builder.Default
    List<ProvenanceRecord> provenance = List.of();

    @Builder.Default
    Map<String, String> fieldOverrides = Map.of();
}
