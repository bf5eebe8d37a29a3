package github.sarthakdev143.film_factory.dto;

public record RegenerateShotRequest(String feedback) {
}
