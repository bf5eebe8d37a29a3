package github.sarthakdev143.film_factory.model;

import java.util.Locale;

public enum JobStatus {
    QUEUED,
    GENERATING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
