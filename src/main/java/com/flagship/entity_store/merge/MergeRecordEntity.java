package com.flagship.entity_store.merge;

import com.flagship.entity_store.entity.EntityType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "merge_records")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MergeRecordEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "candidate_id", nullable = false, updatable = false)
    private UUID candidateId;

    @Column(name = "entity_type", nullable = false, updatable = false)
    private String entityType;

    @Column(name = "survivor_id")
    private UUID survivorId;

    @Column(name = "absorbed_id")
    private UUID absorbedId;

    @Column(name = "absorbed_snapshot")
    private String absorbedSnapshot;

    @Column(name = "identifiers_transferred", nullable = false, updatable = false)
    private int identifiersTransferred;

    @Column(name = "contact_methods_transferred", nullable = false, updatable = false)
    private int contactMethodsTransferred;

    @Column(name = "affiliations_transferred", nullable = false, updatable = false)
    private int affiliationsTransferred;

    @Column(name = "provenance_transferred", nullable = false, updatable = false)
    private int provenanceTransferred;

    @Convert(converter = ItemIdsConverter.class)
    @Column(name = "repointed_affiliations", updatable = false)
    private List<UUID> repointedAffiliationIds;

    @Column(name = "merged_by", updatable = false)
    private String mergedBy;

    @Column(name = "merged_at", nullable = false, updatable = false)
    private Instant mergedAt;

    @Column(name = "split_at")
    private Instant splitAt;

    @Column(name = "split_entity_id")
    private UUID splitEntityId;

    @Column(name = "split_by")
    private String splitBy;

    static MergeRecordEntity fromDomain(MergeRecord record) {
        return new MergeRecordEntity(
            record.getId(),
            record.getCandidateId(),
            record.getEntityType().wireName(),
            record.getSurvivorId(),
            record.getAbsorbedId(),
            record.getAbsorbedSnapshot(),
            record.getIdentifiersTransferred(),
            record.getContactMethodsTransferred(),
            record.getAffiliationsTransferred(),
            record.getProvenanceTransferred(),
            record.getRepointedAffiliationIds(),
            record.getMergedBy(),
            record.getMergedAt(),
            record.getSplitAt(),
            record.getSplitEntityId(),
            record.getSplitBy()
        );
    }

    public MergeRecord toDomain() {
        return new MergeRecord(id, candidateId, EntityType.fromWireName(entityType), survivorId, absorbedId,
            absorbedSnapshot, identifiersTransferred, contactMethodsTransferred, affiliationsTransferred,
            provenanceTransferred, repointedAffiliationIds != null ? repointedAffiliationIds : List.of(),
            mergedBy, mergedAt, splitAt, splitEntityId, splitBy);
    }

    void updateFromDomain(MergeRecord record) {
        this.splitAt = record.getSplitAt();
        this.splitEntityId = record.getSplitEntityId();
        this.splitBy = record.getSplitBy();
    }
}
