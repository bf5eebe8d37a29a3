package github.sarthakdev143.film_factory.ratelimit;

import github.sarthakdev143.film_factory.model.ResourceClass;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * One {@link RateLimiter} per resource class, built once at startup.
 */
public class RateLimiterRegistry {

    private final Map<ResourceClass, RateLimiter> limiters;

    public RateLimiterRegistry(Map<ResourceClass, RateLimiter> limiters) {
        this.limiters = new EnumMap<>(ResourceClass.class);
        this.limiters.putAll(limiters);
    }

    public RateLimiter forResource(ResourceClass resourceClass) {
        RateLimiter limiter = limiters.get(resourceClass);
        if (limiter == null) {
            throw new IllegalStateException("No rate limiter configured for " + resourceClass);
        }
        return limiter;
    }

    public Optional<RateLimiter> find(ResourceClass resourceClass) {
        return Optional.ofNullable(limiters.get(resourceClass));
    }
}
