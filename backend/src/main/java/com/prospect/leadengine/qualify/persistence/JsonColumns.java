package com.prospect.leadengine.qualify.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;

/**
 * JSON text columns and timestamp conversion shared by the JDBC repositories.
 */
@Component
public class JsonColumns {
    private static final Logger log = LoggerFactory.getLogger(JsonColumns.class);

    private final ObjectMapper objectMapper;

    public JsonColumns(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable as JSON: " + e.getOriginalMessage(), e);
        }
    }

    public <T> T read(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isBlank()) {
            return fallback;
        }
        try {
            T parsed = objectMapper.readValue(json, type);
            return parsed == null ? fallback : parsed;
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable JSON column value: {}", e.getOriginalMessage());
            return fallback;
        }
    }

    public <T> T read(String json, Class<T> type, T fallback) {
        if (json == null || json.isBlank()) {
            return fallback;
        }
        try {
            T parsed = objectMapper.readValue(json, type);
            return parsed == null ? fallback : parsed;
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable JSON column value: {}", e.getOriginalMessage());
            return fallback;
        }
    }

    public static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    public static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
