package com.flagship.entity_store.entity.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.entity_store.entity.Affiliation;
import com.flagship.entity_store.entity.ContactMethod;
import com.flagship.entity_store.entity.Identifier;
import com.flagship.entity_store.entity.ProvenanceRecord;
import com.flagship.entity_store.event.payload.EntityCreated;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Initial state of a new entity. The id is optional; the store assigns one otherwise.
 */
@Value
@Builder
@Jacksonized
public class CreateEntityRequest {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("fields")
    Map<String, String> fields;

    @JsonProperty("identifiers")
    List<Identifier> identifiers;

    @JsonProperty("contact_methods")
    List<ContactMethod> contactMethods;

    @JsonProperty("affiliations")
    List<Affiliation> affiliations;

    @JsonProperty("provenance")
    List<ProvenanceRecord> provenance;

    public EntityCreated toPayload() {
        return EntityCreated.builder()
            .fields(fields != null ? fields : Map.of())
            .identifiers(identifiers != null ? identifiers : List.of())
            .contactMethods(contactMethods != null ? contactMethods : List.of())
            .affiliations(affiliations != null ? affiliations : List.of())
            .provenance(provenance != null ? provenance : List.of())
            .build();
    }
}
