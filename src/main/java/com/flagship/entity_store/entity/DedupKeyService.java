package com.flagship.entity_store.entity;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis fast path for append dedup keys.
 *
 * Maps (entity, dedup key) to the id of the event appended under that key. The event
 * log's unique constraint is the source of truth: a miss here, or Redis being down,
 * only means the write path asks the database instead.
 */
@Service
@Slf4j
public class DedupKeyService {

    private static final String REDIS_KEY_PREFIX = "entity-dedup:";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final Duration ttl;

    public DedupKeyService(Optional<StringRedisTemplate> redisTemplate,
                           @Value("${entity-store.dedup.cache-ttl-hours:24}") long ttlHours) {
        this.redisTemplate = redisTemplate;
        this.ttl = Duration.ofHours(ttlHours);
    }

    public Optional<UUID> lookup(EntityRef ref, String dedupKey) {
        if (redisTemplate.isEmpty() || dedupKey == null) {
            return Optional.empty();
        }
        try {
            String eventId = redisTemplate.get().opsForValue().get(redisKey(ref, dedupKey));
            if (eventId != null) {
                log.debug("Dedup key found in Redis: {} / {}", ref, dedupKey);
                return Optional.of(UUID.fromString(eventId));
            }
        } catch (Exception e) {
            log.warn("Redis lookup failed for dedup key of {}: {}. Falling back to event log.", ref, e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Best effort; failures are logged and otherwise ignored.
     */
    public void remember(EntityRef ref, String dedupKey, UUID eventId) {
        if (redisTemplate.isEmpty() || dedupKey == null) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey(ref, dedupKey), eventId.toString(), ttl);
        } catch (Exception e) {
            log.warn("Failed to cache dedup key of {} in Redis: {}", ref, e.getMessage());
        }
    }

    private static String redisKey(EntityRef ref, String dedupKey) {
        return REDIS_KEY_PREFIX + ref + ":" + dedupKey;
    }
}
