package com.flagship.entity_store.merge.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RejectCandidateRequest {

    @NotBlank(message = "Reviewer is required")
    @JsonProperty("reviewer")
    String reviewer;

    @JsonProperty("notes")
    String notes;
}
