package github.sarthakdev143.film_factory.model;

public record AssemblyResult(String artifactRef, double durationSeconds) {
}
