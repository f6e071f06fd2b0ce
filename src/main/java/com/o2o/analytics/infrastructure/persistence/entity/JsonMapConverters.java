package com.o2o.analytics.infrastructure.persistence.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores small maps as JSON text. Key order is preserved.
 */
public final class JsonMapConverters {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonMapConverters() {
    }

    @Converter
    public static class DoubleMapConverter implements AttributeConverter<Map<String, Double>, String> {

        private static final TypeReference<LinkedHashMap<String, Double>> TYPE = new TypeReference<>() {
        };

        @Override
        public String convertToDatabaseColumn(Map<String, Double> attribute) {
            return write(attribute);
        }

        @Override
        public Map<String, Double> convertToEntityAttribute(String dbData) {
            return read(dbData, TYPE);
        }
    }

    @Converter
    public static class StringMapConverter implements AttributeConverter<Map<String, String>, String> {

        private static final TypeReference<LinkedHashMap<String, String>> TYPE = new TypeReference<>() {
        };

        @Override
        public String convertToDatabaseColumn(Map<String, String> attribute) {
            return write(attribute);
        }

        @Override
        public Map<String, String> convertToEntityAttribute(String dbData) {
            return read(dbData, TYPE);
        }
    }

    private static String write(Map<String, ?> attribute) {
        try {
            return MAPPER.writeValueAsString(attribute == null ? Map.of() : attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize map column", e);
        }
    }

    private static <M extends Map<String, ?>> M read(String dbData, TypeReference<M> type) {
        try {
            return MAPPER.readValue(dbData == null || dbData.isBlank() ? "{}" : dbData, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot read map column", e);
        }
    }
}
