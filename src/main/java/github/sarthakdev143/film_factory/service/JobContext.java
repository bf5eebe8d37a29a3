package github.sarthakdev143.film_factory.service;

import github.sarthakdev143.film_factory.model.ExternalPredictionRef;

/**
 * Handle given to running work for reporting liveness and in-flight state of its own job.
 */
public interface JobContext {

    String jobId();

    String ownerId();

    String targetId();

    void heartbeat();

    /**
     * Persists the provider correlation id so the job can be resumed after a restart.
     */
    void recordPrediction(ExternalPredictionRef ref);
}
