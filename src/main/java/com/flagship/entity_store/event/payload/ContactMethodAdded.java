package com.flagship.entity_store.event.payload;

import com.flagship.entity_store.entity.ContactMethod;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ContactMethodAdded implements EventPayload {
    ContactMethod contactMethod;
}
