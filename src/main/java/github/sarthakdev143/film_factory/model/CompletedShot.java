package github.sarthakdev143.film_factory.model;

public record CompletedShot(int number, String artifactRef) {
}
