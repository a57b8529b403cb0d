package com.flagship.entity_store.entity;

import java.util.Arrays;
import java.util.Locale;

/**
 * Entity types living in the store.
 *
 * The wire name is the discriminant carried by every {@link EntityRef} and stored
 * in the entity_type column of each event-store table.
 */
public enum EntityType {
    CONTACT("contact"),
    COMPANY("company");

    private final String wireName;

    EntityType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parses a wire name (case-insensitive).
     *
     * @throws IllegalArgumentException if the name is not a known entity type
     */
    public static EntityType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Entity type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown entity type: " + value));
    }
}
