package github.sarthakdev143.film_factory.dto;

public record FilmSubmissionResponse(
        String filmId,
        String status,
        String message) {
}
