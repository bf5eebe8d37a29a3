package github.sarthakdev143.film_factory.dto;

public record FilmShotRequest(
        Integer number,
        String prompt,
        String referenceImageUrl,
        Integer durationSeconds) {
}
