package com.metering.fetch.storage.jpa;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;

/**
 * Stores a point-name list as a JSON array in a text column.
 */
@Converter
public class PointListConverter implements AttributeConverter<List<String>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() { };

    @Override
    public String convertToDatabaseColumn(List<String> points) {
        try {
            return MAPPER.writeValueAsString(points == null ? List.of() : points);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize point list", e);
        }
    }

    @Override
    public List<String> convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) {
            return List.of();
        }
        try {
            return MAPPER.readValue(column, LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt point list column: " + column, e);
        }
    }
}
