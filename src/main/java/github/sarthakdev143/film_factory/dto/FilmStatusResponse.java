package github.sarthakdev143.film_factory.dto;

import github.sarthakdev143.film_factory.model.CompletedShot;
import github.sarthakdev143.film_factory.model.FilmJobSnapshot;

import java.time.Instant;
import java.util.List;

public record FilmStatusResponse(
        String filmId,
        String status,
        int totalShots,
        List<CompletedShot> completedShots,
        List<Integer> failedShots,
        String finalArtifactRef,
        Double finalDurationSeconds,
        String errorMessage,
        Costs costs,
        Instant createdAt,
        Instant updatedAt) {

    public record Costs(double sceneRefs, double videos, double total) {
    }

    public static FilmStatusResponse from(FilmJobSnapshot film) {
        return new FilmStatusResponse(
                film.filmId(),
                film.status().toApiValue(),
                film.totalShots(),
                film.completedShots(),
                film.failedShots(),
                film.finalArtifactRef(),
                film.finalDurationSeconds(),
                film.errorMessage(),
                new Costs(film.costSceneRefs(), film.costVideos(), film.costTotal()),
                film.createdAt(),
                film.updatedAt());
    }
}
