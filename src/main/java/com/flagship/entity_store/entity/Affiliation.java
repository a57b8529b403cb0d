package com.flagship.entity_store.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Employment or membership link from an entity to an organization.
 *
 * The organization is a type-tagged reference, so a contact can be affiliated with
 * a company and a company with a parent company without untyped foreign keys.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Affiliation implements OwnedItem {
    UUID id;
    EntityRef organization;
    String role;
    LocalDate startedOn;
    LocalDate endedOn;
    UUID originEntityId;
    UUID provenanceId;

    @JsonIgnore
    public boolean isCurrent() {
        return endedOn == null;
    }
}
