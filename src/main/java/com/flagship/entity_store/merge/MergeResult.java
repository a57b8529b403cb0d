package com.flagship.entity_store.merge;

import com.flagship.entity_store.entity.EntityState;
import lombok.Value;

/**
 * Outcome of an executed merge: the reviewed candidate, both entities as committed
 * and the audit record.
 */
@Value
public class MergeResult {
    MatchCandidate candidate;
    EntityState survivor;
    EntityState absorbed;
    MergeRecord record;
}
