package github.sarthakdev143.film_factory.store;

import github.sarthakdev143.film_factory.model.CompletedShot;
import github.sarthakdev143.film_factory.model.FilmJobSnapshot;
import github.sarthakdev143.film_factory.model.FilmJobStatus;
import github.sarthakdev143.film_factory.model.ShotSpec;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface FilmJobStore {

    FilmJobSnapshot create(String filmId, String ownerId, List<ShotSpec> shots);

    Optional<FilmJobSnapshot> find(String filmId);

    List<ShotSpec> shots(String filmId);

    /**
     * Adds or replaces the shot with the same number and clears it from the failed list.
     */
    FilmJobSnapshot recordShotCompleted(String filmId, CompletedShot shot, double sceneRefCost, double videoCost);

    FilmJobSnapshot recordShotFailed(String filmId, int shotNumber, double sceneRefCost);

    FilmJobSnapshot transition(String filmId, FilmJobStatus status, String errorMessage);

    FilmJobSnapshot markAssembled(String filmId, FilmJobStatus status, String artifactRef, double durationSeconds);

    /**
     * Marks every film left generating or assembling by a previous process as interrupted.
     *
     * @param updatedBefore films touched at or after this instant belong to the current process
     * @return number of films changed
     */
    int markInterrupted(Instant updatedBefore);
}
