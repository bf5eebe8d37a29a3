package github.sarthakdev143.film_factory.dto;

import java.util.List;

public record StartFilmRequest(
        String ownerId,
        List<FilmShotRequest> shots) {
}
