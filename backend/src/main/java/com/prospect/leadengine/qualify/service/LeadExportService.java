package com.prospect.leadengine.qualify.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prospect.leadengine.qualify.model.Lead;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * JSON export of scored leads. The derived priority is written for readers but ignored when parsing back.
 */
@Service
public class LeadExportService {
    private static final TypeReference<List<Lead>> LEAD_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public LeadExportService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String export(List<Lead> leads) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter()
                .writeValueAsString(leads == null ? List.of() : leads);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to export leads", e);
        }
    }

    public List<Lead> parse(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, LEAD_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid lead export: " + e.getOriginalMessage(), e);
        }
    }
}
