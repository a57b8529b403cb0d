package com.flagship.entity_store.entity.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class AppendEventRequest {

    @NotBlank(message = "Event type is required")
    @JsonProperty("event_type")
    String eventType;

    @NotNull(message = "Payload is required")
    @JsonProperty("payload")
    JsonNode payload;
}
