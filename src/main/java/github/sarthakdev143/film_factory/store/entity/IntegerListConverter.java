package github.sarthakdev143.film_factory.store.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class IntegerListConverter extends JsonAttributeConverter<List<Integer>> {

    public IntegerListConverter() {
        super(new TypeReference<>() {
        });
    }
}
