package com.flagship.entity_store.merge.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.entity_store.entity.EntityRef;
import com.flagship.entity_store.merge.MatchCandidate;
import com.flagship.entity_store.merge.MatchStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class MatchCandidateResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("entity_a")
    EntityRef entityA;

    @JsonProperty("entity_b")
    EntityRef entityB;

    @JsonProperty("confidence")
    double confidence;

    @JsonProperty("signals")
    Map<String, Double> signals;

    @JsonProperty("status")
    MatchStatus status;

    @JsonProperty("survivor")
    EntityRef survivor;

    @JsonProperty("submitted_by")
    String submittedBy;

    @JsonProperty("submitted_at")
    Instant submittedAt;

    @JsonProperty("reviewed_by")
    String reviewedBy;

    @JsonProperty("reviewed_at")
    Instant reviewedAt;

    @JsonProperty("review_notes")
    String reviewNotes;

    /**
     * Erased participants come back as null references.
     */
    public static MatchCandidateResponse from(MatchCandidate candidate) {
        return MatchCandidateResponse.builder()
            .id(candidate.getId())
            .entityA(ref(candidate, candidate.getEntityAId()))
            .entityB(ref(candidate, candidate.getEntityBId()))
            .confidence(candidate.getConfidence())
            .signals(candidate.getSignals())
            .status(candidate.getStatus())
            .survivor(ref(candidate, candidate.getSurvivorId()))
            .submittedBy(candidate.getSubmittedBy())
            .submittedAt(candidate.getSubmittedAt())
            .reviewedBy(candidate.getReviewedBy())
            .reviewedAt(candidate.getReviewedAt())
            .reviewNotes(candidate.getReviewNotes())
            .build();
    }

    private static EntityRef ref(MatchCandidate candidate, UUID id) {
        return id != null ? EntityRef.of(candidate.getEntityType(), id) : null;
    }
}
