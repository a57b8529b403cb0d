package com.flagship.entity_store.entity;

public enum ContactMethodKind {
    EMAIL,
    PHONE,
    ADDRESS,
    WEBSITE,
    SOCIAL_PROFILE
}
