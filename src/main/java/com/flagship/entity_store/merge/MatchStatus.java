package com.flagship.entity_store.merge;

/**
 * Review status of a match candidate.
 */
public enum MatchStatus {
    /**
     * Submitted by the matching pipeline, awaiting review.
     */
    PENDING,

    /**
     * Approved by a reviewer and merged. Can still be split.
     */
    APPROVED,

    /**
     * Rejected on review, or split after a merge. Terminal.
     */
    REJECTED,

    /**
     * Merged without review because confidence met the auto-merge threshold.
     * Can still be split.
     */
    AUTO_MERGED
}
