package com.flagship.entity_store.event.payload;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class FieldsUpdated implements EventPayload {

    @Builder.Default
    Map<String, String> set = Map.of();

    @Builder.Default
    List<String> cleared = List.of();
}
