package com.flagship.entity_store.event.payload;

public enum MergeRole {
    SURVIVOR,
    ABSORBED
}
