package com.flagship.entity_store.merge;

import com.flagship.entity_store.entity.EntityType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * JPA entity for match candidates.
 *
 * No setters: the status only moves through {@link #updateFromDomain(MatchCandidate)}
 * with a domain object whose transition was already validated. The version column
 * makes concurrent reviews of one candidate fail instead of overwriting each other.
 */
@Entity
@Table(name = "match_candidates")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MatchCandidateEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "entity_type", nullable = false, updatable = false)
    private String entityType;

    @Column(name = "entity_a_id")
    private UUID entityAId;

    @Column(name = "entity_b_id")
    private UUID entityBId;

    @Column(nullable = false, updatable = false)
    private double confidence;

    @Convert(converter = SignalsConverter.class)
    @Column(name = "signals")
    private Map<String, Double> signals;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MatchStatus status;

    @Column(name = "survivor_id")
    private UUID survivorId;

    @Column(name = "submitted_by", updatable = false)
    private String submittedBy;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private Instant submittedAt;

    @Column(name = "reviewed_by")
    private String reviewedBy;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    @Column(name = "review_notes")
    private String reviewNotes;

    @Version
    @Column(nullable = false)
    private Long version;

    static MatchCandidateEntity fromDomain(MatchCandidate candidate) {
        return new MatchCandidateEntity(
            candidate.getId(),
            candidate.getEntityType().wireName(),
            candidate.getEntityAId(),
            candidate.getEntityBId(),
            candidate.getConfidence(),
            candidate.getSignals(),
            candidate.getStatus(),
            candidate.getSurvivorId(),
            candidate.getSubmittedBy(),
            candidate.getSubmittedAt(),
            candidate.getReviewedBy(),
            candidate.getReviewedAt(),
            candidate.getReviewNotes(),
            null
        );
    }

    public MatchCandidate toDomain() {
        return new MatchCandidate(
            id,
            EntityType.fromWireName(entityType),
            entityAId,
            entityBId,
            confidence,
            signals != null ? signals : Map.of(),
            status,
            survivorId,
            submittedBy,
            submittedAt,
            reviewedBy,
            reviewedAt,
            reviewNotes
        );
    }

    /**
     * Copies the review outcome. Participants, evidence and submission data never change.
     */
    void updateFromDomain(MatchCandidate candidate) {
        this.status = candidate.getStatus();
        this.survivorId = candidate.getSurvivorId();
        this.reviewedBy = candidate.getReviewedBy();
        this.reviewedAt = candidate.getReviewedAt();
        this.reviewNotes = candidate.getReviewNotes();
    }
}
