package com.flagship.entity_store.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Ledger entry for a relayed event the graph mirror has already handled.
 *
 * Redelivered messages find their entry here and are acknowledged without touching
 * the graph again.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String entityType;
    UUID entityId;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED
    }

    public static ProcessedEvent success(UUID eventId, String eventType, String entityType, UUID entityId,
                                         Instant now) {
        return new ProcessedEvent(eventId, eventType, entityType, entityId, now, ProcessingResult.SUCCESS, null);
    }

    /**
     * Marks an event the mirror does not care about, so it is not looked at again.
     */
    public static ProcessedEvent skipped(UUID eventId, String eventType, String entityType, UUID entityId,
                                         Instant now, String reason) {
        return new ProcessedEvent(eventId, eventType, entityType, entityId, now, ProcessingResult.SKIPPED, reason);
    }
}
