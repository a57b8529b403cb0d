package com.flagship.entity_store.health;

import com.flagship.entity_store.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated probe for load balancers. DOWN only when the event store cannot be
 * queried; a relay backlog is reported but does not fail the probe.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final JdbcTemplate jdbcTemplate;
    private final OutboxMetrics outboxMetrics;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean eventStoreUp = eventStoreAnswers();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", eventStoreUp ? "UP" : "DOWN");
        body.put("timestamp", clock.instant().toString());
        body.put("eventStore", eventStoreUp ? "UP" : "DOWN");
        body.put("relayBacklog", outboxMetrics.getBacklogSize());

        return ResponseEntity.status(eventStoreUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private boolean eventStoreAnswers() {
        try {
            jdbcTemplate.queryForObject("SELECT COUNT(*) FROM entity_sequences WHERE 1 = 0", Long.class);
            return true;
        } catch (DataAccessException e) {
            log.warn("Event store health probe failed: {}", e.getMessage());
            return false;
        }
    }
}
