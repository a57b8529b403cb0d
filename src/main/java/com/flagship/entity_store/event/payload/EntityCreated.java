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
 * Initial state of an entity. A split creates the new identity with one of these,
 * carrying the partitioned items plus splitFrom and candidateId.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class EntityCreated implements EventPayload {

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

    UUID splitFrom;
    UUID candidateId;
}
