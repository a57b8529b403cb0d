package com.flagship.entity_store.entity.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.entity_store.entity.EntityState;
import lombok.Value;

import java.util.List;

@Value
public class EntityListResponse {

    @JsonProperty("items")
    List<EntityState> items;

    @JsonProperty("total")
    long total;

    @JsonProperty("limit")
    int limit;

    @JsonProperty("offset")
    int offset;
}
