package github.sarthakdev143.film_factory.store.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import github.sarthakdev143.film_factory.model.CompletedShot;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class CompletedShotListConverter extends JsonAttributeConverter<List<CompletedShot>> {

    public CompletedShotListConverter() {
        super(new TypeReference<>() {
        });
    }
}
