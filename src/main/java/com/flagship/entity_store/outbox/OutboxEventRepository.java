package com.flagship.entity_store.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    /**
     * Unpublished relay messages in commit order, skipping rows another relay
     * instance holds. Dead-lettered rows are left out.
     */
    @Query(value = """
        SELECT * FROM outbox_events
        WHERE published_at IS NULL AND retry_count < :maxRetries
        ORDER BY sequence_number ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEventEntity> claimUnpublished(@Param("limit") int limit, @Param("maxRetries") int maxRetries);

    List<OutboxEventEntity> findByEntityTypeAndEntityIdOrderBySequenceNumberAsc(String entityType, UUID entityId);

    long countByPublishedAtIsNull();

    long countByPublishedAtIsNullAndRetryCountGreaterThanEqual(int retryCount);

    @Query("SELECT MIN(e.createdAt) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    Optional<Instant> findOldestUnpublishedCreatedAt();

    /**
     * Compliance erasure only: removes published messages too.
     */
    @Modifying
    @Query("DELETE FROM OutboxEventEntity e WHERE e.entityType = :entityType AND e.entityId = :entityId")
    int deleteForEntity(@Param("entityType") String entityType, @Param("entityId") UUID entityId);
}
