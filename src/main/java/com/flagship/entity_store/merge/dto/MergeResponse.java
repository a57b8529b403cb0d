package com.flagship.entity_store.merge.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.entity_store.entity.EntityState;
import com.flagship.entity_store.merge.MergeResult;
import com.flagship.entity_store.merge.SplitResult;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Response for approve and split: the candidate plus the entities the operation wrote.
 */
@Value
@Builder
public class MergeResponse {

    @JsonProperty("candidate")
    MatchCandidateResponse candidate;

    @JsonProperty("survivor")
    EntityState survivor;

    @JsonProperty("absorbed")
    EntityState absorbed;

    @JsonProperty("split_entity")
    EntityState splitEntity;

    @JsonProperty("merge_record_id")
    UUID mergeRecordId;

    public static MergeResponse from(MergeResult result) {
        return MergeResponse.builder()
            .candidate(MatchCandidateResponse.from(result.getCandidate()))
            .survivor(result.getSurvivor())
            .absorbed(result.getAbsorbed())
            .mergeRecordId(result.getRecord().getId())
            .build();
    }

    public static MergeResponse from(SplitResult result) {
        return MergeResponse.builder()
            .candidate(MatchCandidateResponse.from(result.getCandidate()))
            .survivor(result.getSurvivor())
            .splitEntity(result.getSplitEntity())
            .mergeRecordId(result.getRecord().getId())
            .build();
    }
}
