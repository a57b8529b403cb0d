package com.flagship.entity_store.compliance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.entity_store.compliance.ErasureRecord;
import com.flagship.entity_store.entity.EntityRef;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ErasureResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("entity")
    EntityRef entity;

    @JsonProperty("events_deleted")
    int eventsDeleted;

    @JsonProperty("snapshots_deleted")
    int snapshotsDeleted;

    @JsonProperty("requested_by")
    String requestedBy;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("erased_at")
    Instant erasedAt;

    public static ErasureResponse from(ErasureRecord record) {
        return ErasureResponse.builder()
            .id(record.getId())
            .entity(record.getRef())
            .eventsDeleted(record.getEventsDeleted())
            .snapshotsDeleted(record.getSnapshotsDeleted())
            .requestedBy(record.getRequestedBy())
            .reason(record.getReason())
            .erasedAt(record.getErasedAt())
            .build();
    }
}
