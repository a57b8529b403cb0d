package com.flagship.entity_store.merge;

import com.flagship.entity_store.entity.EntityType;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Audit record of one executed merge: who merged what, what moved, and the absorbed
 * entity's state right before the merge (JSON). For organizations it also lists the
 * affiliation items of other entities that were re-pointed from the absorbed identity
 * to the survivor. A split stamps the record with the split time and the id of the
 * entity it recreated.
 */
@Value
public class MergeRecord {
    UUID id;
    UUID candidateId;
    EntityType entityType;
    UUID survivorId;
    UUID absorbedId;
    String absorbedSnapshot;
    int identifiersTransferred;
    int contactMethodsTransferred;
    int affiliationsTransferred;
    int provenanceTransferred;
    List<UUID> repointedAffiliationIds;
    String mergedBy;
    Instant mergedAt;
    Instant splitAt;
    UUID splitEntityId;
    String splitBy;

    public boolean isSplit() {
        return splitAt != null;
    }

    public MergeRecord markSplit(UUID newEntityId, String actor, Instant now) {
        if (isSplit()) {
            throw new IllegalStateException("Merge " + id + " was already split at " + splitAt);
        }
        return new MergeRecord(id, candidateId, entityType, survivorId, absorbedId, absorbedSnapshot,
            identifiersTransferred, contactMethodsTransferred, affiliationsTransferred, provenanceTransferred,
            repointedAffiliationIds, mergedBy, mergedAt, now, newEntityId, actor);
    }
}
