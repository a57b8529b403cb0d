package com.flagship.entity_store.merge;

import com.flagship.entity_store.entity.EntityState;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * What a merge of a candidate would combine, for a reviewer to decide on survivor and
 * field overrides.
 */
@Value
@Builder
public class MergePreview {
    UUID candidateId;
    EntityState entityA;
    EntityState entityB;

    /**
     * Fields present on both entities with different values, as [A's value, B's value].
     */
    Map<String, List<String>> conflictingFields;

    Map<String, Integer> countsA;
    Map<String, Integer> countsB;
    Map<String, Integer> combined;
}
