package com.flagship.entity_store.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;

/**
 * Jackson configuration for event payloads, projected state and outbox messages.
 *
 * Key features:
 * - Java 8 date/time support (Instant, LocalDate)
 * - ISO-8601 date format (not timestamps)
 * - Map entries ordered by key so serialized state is stable across replays
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

        // Payloads written by newer versions may carry fields this build does not know
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        return mapper;
    }

    /**
     * Wall clock used to stamp events. Injected so tests can pin time.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
