package github.sarthakdev143.film_factory.store.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;

@Converter
public class JsonMapConverter extends JsonAttributeConverter<Map<String, Object>> {

    public JsonMapConverter() {
        super(new TypeReference<>() {
        });
    }
}
