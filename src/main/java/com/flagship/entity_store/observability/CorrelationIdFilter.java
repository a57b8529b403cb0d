package com.flagship.entity_store.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Tags every API request's log lines with a correlation id and the calling actor.
 *
 * The correlation id comes from X-Correlation-ID when the caller sends one and is
 * echoed on the response either way.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    static final String ACTOR_HEADER = "X-Actor-Id";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        CorrelationContext.setCorrelationId(request.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
        String correlationId = CorrelationContext.getCorrelationId();
        response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);

        String actor = request.getHeader(ACTOR_HEADER);
        try (MDC.MDCCloseable ignoredId = MDC.putCloseable(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
             MDC.MDCCloseable ignoredActor = MDC.putCloseable(CorrelationContext.ACTOR_MDC_KEY,
                 actor != null && !actor.isBlank() ? actor : "anonymous")) {
            chain.doFilter(request, response);
        } finally {
            CorrelationContext.clear();
            MDC.remove(CorrelationContext.ENTITY_REF_MDC_KEY);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }
}
