package com.flagship.entity_store.entity;

import java.util.UUID;

/**
 * A child record of an entity that can move between identities on merge and split.
 *
 * The origin entity id survives merges; it is what lets a split send the item back to
 * the identity it came from. A split stamps the entity it creates as the new origin.
 */
public interface OwnedItem {

    UUID getId();

    UUID getOriginEntityId();

    /**
     * Provenance record this item was imported with, or null for manual entry.
     */
    UUID getProvenanceId();
}
