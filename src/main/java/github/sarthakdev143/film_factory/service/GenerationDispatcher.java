package github.sarthakdev143.film_factory.service;

import github.sarthakdev143.film_factory.model.GenerationJob;
import github.sarthakdev143.film_factory.model.JobType;

import java.util.concurrent.CompletableFuture;

public interface GenerationDispatcher {

    /**
     * Records the job and schedules {@code work} in the background. A duplicate request for a job
     * that is still queued or generating returns the existing id and schedules nothing.
     */
    DispatchedJob submit(String ownerId, JobType jobType, String targetId, GenerationWork work);

    /**
     * Continues an existing generating job without creating a new row or taking a rate-limit permit.
     */
    void resume(GenerationJob job, GenerationWork work);

    /**
     * Completes with the terminal snapshot once the job finishes in this process.
     */
    CompletableFuture<GenerationJob> completion(String jobId);
}
