package com.tournament.platform.repository;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Converts typed models to and from store documents.
 */
@Component
public class DocumentMapper {
    
    public static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {};
    
    private final ObjectMapper objectMapper;
    
    public DocumentMapper() {
        this.objectMapper = createObjectMapper();
    }
    
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }
    
    public Map<String, Object> toDocument(Object model) {
        return objectMapper.convertValue(model, DOCUMENT_TYPE);
    }
    
    public <T> T fromDocument(Map<String, Object> document, Class<T> type) {
        return objectMapper.convertValue(document, type);
    }
    
    /**
     * Single value in document form, e.g. an Instant as its ISO-8601 string.
     */
    public Object toValue(Object value) {
        return objectMapper.convertValue(value, Object.class);
    }
    
    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
