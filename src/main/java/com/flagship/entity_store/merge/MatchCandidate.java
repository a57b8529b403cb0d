package com.flagship.entity_store.merge;

import com.flagship.entity_store.entity.EntityType;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A pair of entities an identity-resolution pipeline believes to be the same, with the
 * evidence for it and its review outcome.
 *
 * Transitions:
 * PENDING -> APPROVED | REJECTED | AUTO_MERGED
 * APPROVED | AUTO_MERGED -> REJECTED (split only)
 *
 * Entity ids become null only when compliance erasure removes an entity.
 */
@Value
public class MatchCandidate {
    UUID id;
    EntityType entityType;
    UUID entityAId;
    UUID entityBId;
    double confidence;
    Map<String, Double> signals;
    MatchStatus status;
    UUID survivorId;
    String submittedBy;
    Instant submittedAt;
    String reviewedBy;
    Instant reviewedAt;
    String reviewNotes;

    public static MatchCandidate submit(EntityType entityType, UUID entityAId, UUID entityBId,
                                        double confidence, Map<String, Double> signals,
                                        String submittedBy, Instant now) {
        if (entityAId.equals(entityBId)) {
            throw new IllegalArgumentException("A match candidate needs two different entities");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0 and 1, got " + confidence);
        }
        return new MatchCandidate(UUID.randomUUID(), entityType, entityAId, entityBId, confidence,
            signals != null ? Map.copyOf(signals) : Map.of(), MatchStatus.PENDING, null,
            submittedBy, now, null, null, null);
    }

    /**
     * Approved by a reviewer, with the chosen survivor.
     */
    public MatchCandidate approve(UUID survivorId, String reviewer, Instant now) {
        requireStatus(MatchStatus.APPROVED);
        return withReview(MatchStatus.APPROVED, checkParticipant(survivorId), reviewer, now, reviewNotes);
    }

    public MatchCandidate autoMerge(UUID survivorId, Instant now) {
        requireStatus(MatchStatus.AUTO_MERGED);
        return withReview(MatchStatus.AUTO_MERGED, checkParticipant(survivorId), "system", now, reviewNotes);
    }

    public MatchCandidate reject(String reviewer, String notes, Instant now) {
        if (status != MatchStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Cannot reject candidate in %s status. Only PENDING candidates can be rejected; " +
                    "merged candidates are reversed by a split.", status));
        }
        return withReview(MatchStatus.REJECTED, null, reviewer, now, notes);
    }

    /**
     * Reverses an executed merge.
     */
    public MatchCandidate split(String actor, Instant now) {
        if (!isMerged()) {
            throw new IllegalStateException(
                String.format("Cannot split candidate in %s status. Only APPROVED or AUTO_MERGED candidates " +
                    "can be split.", status));
        }
        return withReview(MatchStatus.REJECTED, survivorId, actor, now, "split");
    }

    public boolean isMerged() {
        return status == MatchStatus.APPROVED || status == MatchStatus.AUTO_MERGED;
    }

    public boolean canTransitionTo(MatchStatus target) {
        return switch (status) {
            case PENDING -> target != MatchStatus.PENDING;
            case APPROVED, AUTO_MERGED -> target == MatchStatus.REJECTED;
            case REJECTED -> false;
        };
    }

    /**
     * The participant that is not the survivor.
     */
    public UUID otherThan(UUID survivor) {
        return survivor.equals(entityAId) ? entityBId : entityAId;
    }

    private void requireStatus(MatchStatus target) {
        if (status != MatchStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Cannot move candidate from %s to %s. Only PENDING candidates can be merged.",
                    status, target));
        }
    }

    private UUID checkParticipant(UUID candidateSurvivor) {
        if (!candidateSurvivor.equals(entityAId) && !candidateSurvivor.equals(entityBId)) {
            throw new IllegalArgumentException("Survivor " + candidateSurvivor + " is not part of candidate " + id);
        }
        return candidateSurvivor;
    }

    private MatchCandidate withReview(MatchStatus newStatus, UUID survivor, String reviewer, Instant now,
                                      String notes) {
        return new MatchCandidate(id, entityType, entityAId, entityBId, confidence, signals, newStatus,
            survivor, submittedBy, submittedAt, reviewer, now, notes);
    }
}
