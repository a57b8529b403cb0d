package com.flagship.entity_store.observability;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for the entity store.
 *
 * Metrics exposed:
 * - entity_store.events.appended: events appended, by entity type, event type and outcome
 * - entity_store.append.latency: end-to-end append time including retries
 * - entity_store.write.retries: ordering conflicts and lock failures retried
 * - entity_store.replay.depth: events folded per reconstruction
 * - entity_store.projection.divergence: rows found different from their replay
 * - entity_store.snapshots.taken, entity_store.merges, entity_store.splits, entity_store.erasures
 */
@Component
public class EntityStoreMetrics {

    private final MeterRegistry registry;
    private final DistributionSummary replayDepth;

    public EntityStoreMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.replayDepth = DistributionSummary.builder("entity_store.replay.depth")
                .description("Events folded on top of the starting state per reconstruction")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordAppend(String entityType, String eventType, String outcome) {
        registry.counter("entity_store.events.appended",
                "entity_type", sanitizeTag(entityType),
                "event_type", sanitizeTag(eventType),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordAppendLatency(String entityType, long durationMs) {
        Timer.builder("entity_store.append.latency")
                .tag("entity_type", sanitizeTag(entityType))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordRetry(String operation, String cause) {
        registry.counter("entity_store.write.retries",
                "operation", sanitizeTag(operation),
                "cause", sanitizeTag(cause)
        ).increment();
    }

    public void recordReplayDepth(int events) {
        replayDepth.record(events);
    }

    public void recordDivergence(String entityType, boolean repaired) {
        registry.counter("entity_store.projection.divergence",
                "entity_type", sanitizeTag(entityType),
                "repaired", String.valueOf(repaired)
        ).increment();
    }

    public void recordSnapshotTaken(String entityType) {
        registry.counter("entity_store.snapshots.taken",
                "entity_type", sanitizeTag(entityType)
        ).increment();
    }

    public void recordMerge(String entityType, String status) {
        registry.counter("entity_store.merges",
                "entity_type", sanitizeTag(entityType),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordSplit(String entityType) {
        registry.counter("entity_store.splits",
                "entity_type", sanitizeTag(entityType)
        ).increment();
    }

    public void recordErasure(String entityType) {
        registry.counter("entity_store.erasures",
                "entity_type", sanitizeTag(entityType)
        ).increment();
    }

    public void recordDedupHit(String source) {
        registry.counter("entity_store.dedup.hits",
                "source", sanitizeTag(source)
        ).increment();
    }

    // ==================== Graph Mirror Consumer ====================

    public void recordEventProcessed(String eventType, boolean wasNew) {
        registry.counter("graph_mirror.events.processed",
                "event_type", sanitizeTag(eventType),
                "was_new", String.valueOf(wasNew)
        ).increment();
    }

    public void recordEventProcessingFailure(String eventType, String error) {
        registry.counter("graph_mirror.events.failed",
                "event_type", sanitizeTag(eventType),
                "error", sanitizeTag(error)
        ).increment();
    }

    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value.length() > 64 ? value.substring(0, 64) : value;
    }
}
