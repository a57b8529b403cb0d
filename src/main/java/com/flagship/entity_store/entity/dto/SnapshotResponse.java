package com.flagship.entity_store.entity.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.entity_store.snapshot.Snapshot;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot metadata; the captured state is left out.
 */
@Value
@Builder
public class SnapshotResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("as_of_sequence")
    long asOfSequence;

    @JsonProperty("as_of_occurred_at")
    Instant asOfOccurredAt;

    @JsonProperty("taken_at")
    Instant takenAt;

    public static SnapshotResponse from(Snapshot snapshot) {
        return SnapshotResponse.builder()
            .id(snapshot.getId())
            .asOfSequence(snapshot.getAsOfSequence())
            .asOfOccurredAt(snapshot.getAsOfOccurredAt())
            .takenAt(snapshot.getTakenAt())
            .build();
    }
}
