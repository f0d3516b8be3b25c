package com.spacebooking.scheduling.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link RecurringPattern} as a JSON document in a text column.
 */
@Converter
public class RecurringPatternConverter implements AttributeConverter<RecurringPattern, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(RecurringPattern pattern) {
        if (pattern == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(pattern);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize recurring pattern", e);
        }
    }

    @Override
    public RecurringPattern convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, RecurringPattern.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot read recurring pattern: " + json, e);
        }
    }
}
