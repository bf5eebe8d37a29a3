package github.sarthakdev143.film_factory.service;

import github.sarthakdev143.film_factory.model.JobType;
import github.sarthakdev143.film_factory.retry.RetryPolicy;

import java.util.EnumMap;
import java.util.Map;

/**
 * Retry policy applied around a whole unit of work, per job type.
 */
public class WorkRetryPolicies {

    private final RetryPolicy defaultPolicy;
    private final Map<JobType, RetryPolicy> overrides;

    public WorkRetryPolicies(RetryPolicy defaultPolicy, Map<JobType, RetryPolicy> overrides) {
        this.defaultPolicy = defaultPolicy;
        this.overrides = new EnumMap<>(JobType.class);
        this.overrides.putAll(overrides);
    }

    public static WorkRetryPolicies uniform(RetryPolicy policy) {
        return new WorkRetryPolicies(policy, Map.of());
    }

    public RetryPolicy forType(JobType jobType) {
        return overrides.getOrDefault(jobType, defaultPolicy);
    }
}
