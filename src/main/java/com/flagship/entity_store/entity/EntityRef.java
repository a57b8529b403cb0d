package com.flagship.entity_store.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.UUID;

/**
 * Type-tagged reference to an entity, serialized as {@code <type>:<uuid>}.
 *
 * Stands in for loosely typed (id, type) column pairs: the discriminant travels
 * with the id and is checked whenever a reference is parsed.
 */
public record EntityRef(EntityType type, UUID id) implements Comparable<EntityRef> {

    public EntityRef {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(id, "id is required");
    }

    public static EntityRef of(EntityType type, UUID id) {
        return new EntityRef(type, id);
    }

    public static EntityRef contact(UUID id) {
        return new EntityRef(EntityType.CONTACT, id);
    }

    public static EntityRef company(UUID id) {
        return new EntityRef(EntityType.COMPANY, id);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static EntityRef parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Entity reference is required");
        }
        int separator = value.indexOf(':');
        if (separator <= 0 || separator == value.length() - 1) {
            throw new IllegalArgumentException("Malformed entity reference: " + value);
        }
        EntityType type = EntityType.fromWireName(value.substring(0, separator));
        try {
            return new EntityRef(type, UUID.fromString(value.substring(separator + 1)));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed entity id in reference: " + value, e);
        }
    }

    /**
     * Parses a reference and checks its discriminant against the expected type.
     */
    public static EntityRef parse(String value, EntityType expectedType) {
        EntityRef ref = parse(value);
        if (ref.type() != expectedType) {
            throw new IllegalArgumentException(
                String.format("Expected a %s reference but got %s", expectedType.wireName(), value));
        }
        return ref;
    }

    /**
     * Canonical lock ordering: by type, then by id.
     */
    @Override
    public int compareTo(EntityRef other) {
        int byType = type.compareTo(other.type);
        return byType != 0 ? byType : id.compareTo(other.id);
    }

    @JsonValue
    @Override
    public String toString() {
        return type.wireName() + ":" + id;
    }
}
