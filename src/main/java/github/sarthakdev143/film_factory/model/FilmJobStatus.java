package github.sarthakdev143.film_factory.model;

import java.util.Locale;

public enum FilmJobStatus {
    GENERATING,
    ASSEMBLING,
    READY,
    PARTIAL,
    FAILED,
    INTERRUPTED;

    public boolean isInFlight() {
        return this == GENERATING || this == ASSEMBLING;
    }

    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
