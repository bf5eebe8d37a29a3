package github.sarthakdev143.film_factory.retry;

public enum ErrorKind {
    /** Rate limit, temporary unavailability or timeout. Retried automatically. */
    TRANSIENT,
    /** Malformed request, rejected content or hard provider error. Surfaced immediately. */
    PERMANENT
}
