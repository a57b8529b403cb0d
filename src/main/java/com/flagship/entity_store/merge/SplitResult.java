package com.flagship.entity_store.merge;

import com.flagship.entity_store.entity.EntityState;
import lombok.Value;

@Value
public class SplitResult {
    MatchCandidate candidate;
    EntityState survivor;
    EntityState splitEntity;
    MergeRecord record;
}
