package github.sarthakdev143.film_factory.integration.provider;

import java.time.Duration;

/**
 * @param interval       wait between two polls
 * @param heartbeatEvery how often the owning job's {@code updatedAt} is refreshed while waiting
 * @param maxDuration    total time allowed from the first poll
 */
public record PollSchedule(Duration interval, Duration heartbeatEvery, Duration maxDuration) {

    public PollSchedule {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive.");
        }
        if (maxDuration == null || maxDuration.compareTo(interval) < 0) {
            throw new IllegalArgumentException("Poll max duration must be at least one interval.");
        }
        heartbeatEvery = heartbeatEvery == null ? interval : heartbeatEvery;
    }
}
