package github.sarthakdev143.film_factory.store.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;

/**
 * Stores a structured attribute as a JSON string column.
 */
abstract class JsonAttributeConverter<T> implements AttributeConverter<T, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final TypeReference<T> type;

    JsonAttributeConverter(TypeReference<T> type) {
        this.type = type;
    }

    @Override
    public String convertToDatabaseColumn(T attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize " + attribute.getClass().getSimpleName(), e);
        }
    }

    @Override
    public T convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(column, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Stored JSON column could not be read", e);
        }
    }
}
