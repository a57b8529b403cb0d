package com.flagship.entity_store.consumer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, UUID> {

    List<ProcessedEventEntity> findByEntityTypeAndEntityIdOrderByProcessedAtAsc(String entityType, UUID entityId);

    long countByResult(ProcessedEvent.ProcessingResult result);

    /**
     * Retention cleanup.
     */
    @Modifying
    @Query("DELETE FROM ProcessedEventEntity e WHERE e.processedAt < :before")
    int deleteEventsProcessedBefore(@Param("before") Instant before);
}
