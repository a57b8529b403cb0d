package com.flagship.entity_store.compliance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ErasureRequest {

    @NotBlank(message = "Entity reference is required")
    @JsonProperty("entity")
    String entity;

    @NotBlank(message = "requested_by is required")
    @JsonProperty("requested_by")
    String requestedBy;

    @JsonProperty("reason")
    String reason;
}
