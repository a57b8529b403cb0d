package com.flagship.entity_store.entity.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.entity_store.entity.AppendResult;
import com.flagship.entity_store.entity.EntityState;
import lombok.Builder;
import lombok.Value;

/**
 * The appended event and the entity state right after it.
 */
@Value
@Builder
public class AppendResponse {

    @JsonProperty("event")
    EventResponse event;

    @JsonProperty("state")
    EntityState state;

    @JsonProperty("duplicate")
    boolean duplicate;

    public static AppendResponse from(AppendResult result, ObjectMapper objectMapper) {
        return AppendResponse.builder()
            .event(EventResponse.from(result.getEvent(), objectMapper))
            .state(result.getState())
            .duplicate(result.isDuplicate())
            .build();
    }
}
