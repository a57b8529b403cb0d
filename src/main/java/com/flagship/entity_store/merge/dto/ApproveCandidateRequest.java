package com.flagship.entity_store.merge.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;
import java.util.UUID;

/**
 * Approval of a pending candidate. Without a survivor id the entity created first
 * survives.
 */
@Value
@Builder
@Jacksonized
public class ApproveCandidateRequest {

    @NotBlank(message = "Reviewer is required")
    @JsonProperty("reviewer")
    String reviewer;

    @JsonProperty("survivor_id")
    UUID survivorId;

    @JsonProperty("field_overrides")
    Map<String, String> fieldOverrides;
}
