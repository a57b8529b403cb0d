package com.flagship.entity_store.entity;

import com.flagship.entity_store.entity.exception.OrderingConflictException;
import com.flagship.entity_store.observability.EntityStoreMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Re-runs a whole write transaction when it loses a race.
 *
 * Ordering conflicts and Spring concurrency failures (lock timeouts, deadlocks,
 * serialization failures) are retried with jittered linear backoff. Callers never
 * see them unless the attempt budget runs out.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WriteRetrier {

    private final EntityStoreMetrics metrics;

    @Value("${entity-store.write.max-attempts:20}")
    private int maxAttempts;

    @Value("${entity-store.write.backoff-ms:5}")
    private long backoffMs;

    public <T> T execute(String operation, Supplier<T> transaction) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return transaction.get();
            } catch (OrderingConflictException | ConcurrencyFailureException e) {
                last = e;
                metrics.recordRetry(operation, e.getClass().getSimpleName());
                log.debug("{} attempt {}/{} lost a race: {}", operation, attempt, maxAttempts, e.getMessage());
                pause(attempt);
            }
        }
        log.warn("{} gave up after {} attempts", operation, maxAttempts);
        throw last;
    }

    private void pause(int attempt) {
        if (backoffMs <= 0) {
            return;
        }
        long delay = backoffMs * Math.min(attempt, 10) + ThreadLocalRandom.current().nextLong(backoffMs + 1);
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while retrying write", e);
        }
    }
}
