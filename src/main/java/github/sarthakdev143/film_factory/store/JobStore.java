package github.sarthakdev143.film_factory.store;

import github.sarthakdev143.film_factory.model.CreateOrGetResult;
import github.sarthakdev143.film_factory.model.GenerationJob;
import github.sarthakdev143.film_factory.model.JobStatus;
import github.sarthakdev143.film_factory.model.JobType;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable record of generation jobs. At most one non-terminal job exists per
 * (owner, type, target) triple, and a job's terminal state is written once.
 */
public interface JobStore {

    CreateOrGetResult createOrGet(String ownerId, JobType jobType, String targetId, JobStatus initialStatus);

    /**
     * Moves a queued job to generating. Jobs in any other state are left alone.
     */
    void markGenerating(String jobId);

    /**
     * Replaces the in-flight result without changing status.
     */
    void recordProgress(String jobId, Map<String, Object> result);

    /**
     * Writes the terminal state.
     *
     * @return {@code false} when the job was already terminal and nothing was written
     */
    boolean update(String jobId, JobStatus status, Map<String, Object> result, String errorMessage);

    void heartbeat(String jobId);

    Optional<GenerationJob> find(String jobId);

    List<GenerationJob> listStale(JobStatus status, Instant olderThan, int limit);

    List<GenerationJob> listBy(JobStatus status, JobType jobType);
}
