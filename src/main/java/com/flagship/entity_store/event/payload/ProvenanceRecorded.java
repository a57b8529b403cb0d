package com.flagship.entity_store.event.payload;

import com.flagship.entity_store.entity.ProvenanceRecord;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ProvenanceRecorded implements EventPayload {
    ProvenanceRecord record;
}
