package com.flagship.entity_store.merge;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MergeRecordRepository extends JpaRepository<MergeRecordEntity, UUID> {

    Optional<MergeRecordEntity> findFirstByCandidateIdAndSplitAtIsNull(UUID candidateId);

    List<MergeRecordEntity> findByCandidateIdOrderByMergedAtDesc(UUID candidateId);

    @Modifying
    @Query("UPDATE MergeRecordEntity m SET m.survivorId = NULL WHERE m.survivorId = :entityId")
    int clearSurvivor(@Param("entityId") UUID entityId);

    /**
     * Drops the absorbed id together with the pre-merge state, which holds the
     * entity's personal data.
     */
    @Modifying
    @Query("UPDATE MergeRecordEntity m SET m.absorbedId = NULL, m.absorbedSnapshot = NULL WHERE m.absorbedId = :entityId")
    int clearAbsorbed(@Param("entityId") UUID entityId);

    @Modifying
    @Query("UPDATE MergeRecordEntity m SET m.splitEntityId = NULL WHERE m.splitEntityId = :entityId")
    int clearSplitEntity(@Param("entityId") UUID entityId);
}
