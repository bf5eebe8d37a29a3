package github.sarthakdev143.film_factory.model;

public record CreateOrGetResult(GenerationJob job, boolean alreadyRunning) {
}
