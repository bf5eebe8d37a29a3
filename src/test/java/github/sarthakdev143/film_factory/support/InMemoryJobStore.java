package github.sarthakdev143.film_factory.support;

import github.sarthakdev143.film_factory.model.CreateOrGetResult;
import github.sarthakdev143.film_factory.model.ErrorMessages;
import github.sarthakdev143.film_factory.model.GenerationJob;
import github.sarthakdev143.film_factory.model.JobStatus;
import github.sarthakdev143.film_factory.model.JobType;
import github.sarthakdev143.film_factory.store.JobStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public class InMemoryJobStore implements JobStore {

    private final Map<String, GenerationJob> jobs = new LinkedHashMap<>();
    private final Clock clock;
    private int rejectedTerminalWrites;

    public InMemoryJobStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized CreateOrGetResult createOrGet(String ownerId, JobType jobType, String targetId, JobStatus initialStatus) {
        Optional<GenerationJob> running = jobs.values().stream()
                .filter(job -> !job.status().isTerminal())
                .filter(job -> job.ownerId().equals(ownerId) && job.jobType() == jobType && job.targetId().equals(targetId))
                .findFirst();
        if (running.isPresent()) {
            return new CreateOrGetResult(running.get(), true);
        }
        Instant now = clock.instant();
        GenerationJob job = new GenerationJob(
                UUID.randomUUID().toString(), ownerId, jobType, targetId, initialStatus, Map.of(), null, now, now);
        jobs.put(job.id(), job);
        return new CreateOrGetResult(job, false);
    }

    @Override
    public synchronized void markGenerating(String jobId) {
        GenerationJob job = get(jobId);
        if (job.status() == JobStatus.QUEUED) {
            put(job, JobStatus.GENERATING, job.result(), job.errorMessage());
        }
    }

    @Override
    public synchronized void recordProgress(String jobId, Map<String, Object> result) {
        GenerationJob job = get(jobId);
        if (!job.status().isTerminal()) {
            put(job, job.status(), result, job.errorMessage());
        }
    }

    @Override
    public synchronized boolean update(String jobId, JobStatus status, Map<String, Object> result, String errorMessage) {
        GenerationJob job = get(jobId);
        if (job.status().isTerminal()) {
            rejectedTerminalWrites++;
            return false;
        }
        put(job, status, result, ErrorMessages.truncate(errorMessage));
        return true;
    }

    @Override
    public synchronized void heartbeat(String jobId) {
        GenerationJob job = get(jobId);
        if (!job.status().isTerminal()) {
            put(job, job.status(), job.result(), job.errorMessage());
        }
    }

    @Override
    public synchronized Optional<GenerationJob> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized List<GenerationJob> listStale(JobStatus status, Instant olderThan, int limit) {
        return jobs.values().stream()
                .filter(job -> job.status() == status && job.updatedAt().isBefore(olderThan))
                .sorted(Comparator.comparing(GenerationJob::updatedAt))
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized List<GenerationJob> listBy(JobStatus status, JobType jobType) {
        return jobs.values().stream()
                .filter(job -> job.status() == status && (jobType == null || job.jobType() == jobType))
                .toList();
    }

    public synchronized List<GenerationJob> all() {
        return new ArrayList<>(jobs.values());
    }

    /**
     * Inserts a job as a previous process would have left it.
     */
    public synchronized GenerationJob seed(
            JobType jobType,
            String targetId,
            JobStatus status,
            Map<String, Object> result,
            Instant updatedAt) {
        GenerationJob job = new GenerationJob(
                UUID.randomUUID().toString(), "owner-1", jobType, targetId, status, result, null, updatedAt, updatedAt);
        jobs.put(job.id(), job);
        return job;
    }

    public synchronized int rejectedTerminalWrites() {
        return rejectedTerminalWrites;
    }

    private GenerationJob get(String jobId) {
        GenerationJob job = jobs.get(jobId);
        if (job == null) {
            throw new IllegalArgumentException("Job not found: " + jobId);
        }
        return job;
    }

    private void put(GenerationJob job, JobStatus status, Map<String, Object> result, String errorMessage) {
        jobs.put(job.id(), new GenerationJob(
                job.id(),
                job.ownerId(),
                job.jobType(),
                job.targetId(),
                status,
                result,
                errorMessage,
                job.createdAt(),
                clock.instant()));
    }
}
