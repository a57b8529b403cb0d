package com.flagship.entity_store.entity;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * Ties entity data to the external source it was imported from and to the
 * identity that originally owned it.
 *
 * Source + source id name the upstream record (e.g. "google_contacts" / "people/c123");
 * the origin entity id is what a split partitions on.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ProvenanceRecord {
    UUID id;
    String source;
    String sourceId;
    UUID originEntityId;
    Instant recordedAt;
}
