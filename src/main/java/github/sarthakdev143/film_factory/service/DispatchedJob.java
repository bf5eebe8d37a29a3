package github.sarthakdev143.film_factory.service;

public record DispatchedJob(String jobId, boolean alreadyRunning) {
}
