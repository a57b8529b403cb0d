package com.flagship.entity_store.event.payload;

import com.flagship.entity_store.entity.Affiliation;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class AffiliationAdded implements EventPayload {
    Affiliation affiliation;
}
