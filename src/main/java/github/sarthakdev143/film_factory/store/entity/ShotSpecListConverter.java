package github.sarthakdev143.film_factory.store.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import github.sarthakdev143.film_factory.model.ShotSpec;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class ShotSpecListConverter extends JsonAttributeConverter<List<ShotSpec>> {

    public ShotSpecListConverter() {
        super(new TypeReference<>() {
        });
    }
}
