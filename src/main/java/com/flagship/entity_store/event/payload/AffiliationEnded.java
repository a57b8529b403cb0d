package com.flagship.entity_store.event.payload;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class AffiliationEnded implements EventPayload {
    UUID itemId;
    LocalDate endedOn;
}
