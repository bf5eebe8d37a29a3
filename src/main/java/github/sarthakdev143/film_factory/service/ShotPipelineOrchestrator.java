package github.sarthakdev143.film_factory.service;

import github.sarthakdev143.film_factory.model.FilmJobSnapshot;
import github.sarthakdev143.film_factory.model.ShotSpec;

import java.util.List;
import java.util.Optional;

public interface ShotPipelineOrchestrator {

    /**
     * Creates the film and generates all shots in the background.
     *
     * @return the new film id
     */
    String startFilm(String ownerId, List<ShotSpec> shots);

    /**
     * Generates one shot again and reassembles the film. {@code feedback} is appended to the
     * shot prompt when present.
     */
    void regenerateShot(String filmId, int shotNumber, String feedback);

    Optional<FilmJobSnapshot> find(String filmId);
}
