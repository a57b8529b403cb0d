package com.flagship.entity_store.entity;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class ContactMethod implements OwnedItem {
    UUID id;
    ContactMethodKind kind;
    String value;
    String label;
    UUID originEntityId;
    UUID provenanceId;
}
