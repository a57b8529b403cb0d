package com.flagship.entity_store.entity;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

/**
 * External identifier attached to an entity (email, domain, provider id, ...).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Identifier implements OwnedItem {
    UUID id;
    String type;
    String value;
    UUID originEntityId;
    UUID provenanceId;
}
