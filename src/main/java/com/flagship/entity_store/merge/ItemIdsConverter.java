package com.flagship.entity_store.merge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;
import java.util.UUID;

/**
 * Stores a list of item ids as a JSON array.
 */
@Converter
public class ItemIdsConverter implements AttributeConverter<List<UUID>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<UUID>> TYPE = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(List<UUID> ids) {
        if (ids == null || ids.isEmpty()) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(ids);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable item ids", e);
        }
    }

    @Override
    public List<UUID> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return List.copyOf(MAPPER.readValue(json, TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unreadable item ids", e);
        }
    }
}
