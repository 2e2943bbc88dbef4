package com.openforge.taskcore.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores a record as JSON text in a TEXT column.
 *
 * Unreadable column content maps to null instead of failing the whole load;
 * downstream code treats a null schema as "schema missing".
 */
@Slf4j
abstract class JsonColumnConverter<T> implements AttributeConverter<T, String> {

    // Column JSON keeps its camelCase names, so this mapper is independent of the snake_case API mapper.
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Class<T> type;

    protected JsonColumnConverter(Class<T> type) {
        this.type = type;
    }

    @Override
    public String convertToDatabaseColumn(T attribute) {
        if (attribute == null) return null;
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + type.getSimpleName(), e);
        }
    }

    @Override
    public T convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) return null;
        try {
            return MAPPER.readValue(dbData, type);
        } catch (JsonProcessingException e) {
            log.warn("[Template] Unreadable {} column ({} chars): {}",
                    type.getSimpleName(), dbData.length(), e.getOriginalMessage());
            return null;
        }
    }
}
