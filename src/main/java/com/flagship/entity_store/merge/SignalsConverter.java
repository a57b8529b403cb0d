package com.flagship.entity_store.merge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Map;
import java.util.TreeMap;

/**
 * Stores match signals (signal name -> score) as a JSON object.
 */
@Converter
public class SignalsConverter implements AttributeConverter<Map<String, Double>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<TreeMap<String, Double>> TYPE = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(Map<String, Double> signals) {
        if (signals == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(new TreeMap<>(signals));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable match signals", e);
        }
    }

    @Override
    public Map<String, Double> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return MAPPER.readValue(json, TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unreadable match signals", e);
        }
    }
}
