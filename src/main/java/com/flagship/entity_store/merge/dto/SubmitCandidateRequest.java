package com.flagship.entity_store.merge.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * A candidate pair from the identity-resolution pipeline. Entities are type-tagged
 * references such as {@code contact:<uuid>}.
 */
@Value
@Builder
@Jacksonized
public class SubmitCandidateRequest {

    @NotBlank(message = "entity_a is required")
    @JsonProperty("entity_a")
    String entityA;

    @NotBlank(message = "entity_b is required")
    @JsonProperty("entity_b")
    String entityB;

    @NotNull(message = "Confidence is required")
    @DecimalMin(value = "0.0", message = "Confidence must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Confidence must be between 0 and 1")
    @JsonProperty("confidence")
    Double confidence;

    @JsonProperty("signals")
    Map<String, Double> signals;

    @JsonProperty("submitted_by")
    String submittedBy;
}
