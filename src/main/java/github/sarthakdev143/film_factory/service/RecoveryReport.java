package github.sarthakdev143.film_factory.service;

public record RecoveryReport(int filmsInterrupted, int completed, int failed, int resumed) {
}
