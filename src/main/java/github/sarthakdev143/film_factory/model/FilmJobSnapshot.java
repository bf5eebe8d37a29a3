package github.sarthakdev143.film_factory.model;

import java.time.Instant;
import java.util.List;

public record FilmJobSnapshot(
        String filmId,
        String ownerId,
        FilmJobStatus status,
        int totalShots,
        List<CompletedShot> completedShots,
        List<Integer> failedShots,
        String finalArtifactRef,
        Double finalDurationSeconds,
        String errorMessage,
        double costSceneRefs,
        double costVideos,
        Instant createdAt,
        Instant updatedAt) {

    public FilmJobSnapshot {
        completedShots = completedShots == null ? List.of() : List.copyOf(completedShots);
        failedShots = failedShots == null ? List.of() : List.copyOf(failedShots);
    }

    public double costTotal() {
        return costSceneRefs + costVideos;
    }
}
