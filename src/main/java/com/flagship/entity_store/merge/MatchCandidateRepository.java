package com.flagship.entity_store.merge;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface MatchCandidateRepository extends JpaRepository<MatchCandidateEntity, UUID> {

    List<MatchCandidateEntity> findByStatusOrderBySubmittedAtDesc(MatchStatus status);

    List<MatchCandidateEntity> findAllByOrderBySubmittedAtDesc();

    /**
     * Pending candidates over the same pair, in either order.
     */
    @Query("""
        SELECT c FROM MatchCandidateEntity c
        WHERE c.status = com.flagship.entity_store.merge.MatchStatus.PENDING
          AND ((c.entityAId = :first AND c.entityBId = :second)
            OR (c.entityAId = :second AND c.entityBId = :first))
        """)
    List<MatchCandidateEntity> findPendingForPair(@Param("first") UUID first, @Param("second") UUID second);

    @Modifying
    @Query("UPDATE MatchCandidateEntity c SET c.entityAId = NULL WHERE c.entityAId = :entityId")
    int clearEntityA(@Param("entityId") UUID entityId);

    @Modifying
    @Query("UPDATE MatchCandidateEntity c SET c.entityBId = NULL WHERE c.entityBId = :entityId")
    int clearEntityB(@Param("entityId") UUID entityId);

    @Modifying
    @Query("UPDATE MatchCandidateEntity c SET c.survivorId = NULL WHERE c.survivorId = :entityId")
    int clearSurvivor(@Param("entityId") UUID entityId);
}
