package com.flagship.entity_store.entity;

/**
 * Lifecycle status of a materialized entity.
 */
public enum EntityStatus {
    /**
     * Live entity. Accepts writes and appears in listings.
     */
    ACTIVE,

    /**
     * Absorbed into another entity by a merge.
     * Terminal: no further writes, hidden from listings, history kept.
     */
    MERGED,

    /**
     * Soft-deleted. Terminal and hidden from listings; history kept.
     */
    DELETED;

    public boolean isListable() {
        return this == ACTIVE;
    }
}
