package com.flagship.entity_store.observability;

import com.flagship.entity_store.entity.EntityRef;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id and MDC keys shared by the HTTP filter, the write path
 * and the graph-mirror consumer.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ENTITY_REF_MDC_KEY = "entityRef";
    public static final String ACTOR_MDC_KEY = "actor";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short random id, readable in log lines.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Tags log lines with the entity being written until the returned scope closes.
     */
    public static MDC.MDCCloseable withEntity(EntityRef ref) {
        return MDC.putCloseable(ENTITY_REF_MDC_KEY, ref.toString());
    }
}
