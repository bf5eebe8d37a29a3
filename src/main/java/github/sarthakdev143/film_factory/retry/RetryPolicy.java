package github.sarthakdev143.film_factory.retry;

import java.time.Duration;

/**
 * @param maxAttempts    total calls allowed, including the first one
 * @param baseDelay      delay before the first retry; doubles for every further retry
 * @param perCallTimeout bound on a single attempt, {@code null} or zero for none
 * @param jitterRatio    upper bound of the random extra delay, as a fraction of the backoff
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration perCallTimeout, double jitterRatio) {

    public static final double DEFAULT_JITTER_RATIO = 0.3;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1.");
        }
        baseDelay = baseDelay == null ? Duration.ZERO : baseDelay;
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative.");
        }
        if (jitterRatio < 0 || jitterRatio > 1) {
            throw new IllegalArgumentException("jitterRatio must be between 0 and 1.");
        }
    }

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration perCallTimeout) {
        this(maxAttempts, baseDelay, perCallTimeout, DEFAULT_JITTER_RATIO);
    }

    public static RetryPolicy singleAttempt(Duration timeout) {
        return new RetryPolicy(1, Duration.ZERO, timeout, 0);
    }

    public boolean hasTimeout() {
        return perCallTimeout != null && !perCallTimeout.isZero() && !perCallTimeout.isNegative();
    }

    /**
     * Minimum wait before the retry that follows failed attempt {@code attempt} (0-based).
     */
    public Duration backoffFor(int attempt) {
        return baseDelay.multipliedBy(1L << Math.min(attempt, 30));
    }
}
