package github.sarthakdev143.film_factory.service.impl;

import github.sarthakdev143.film_factory.model.CreateOrGetResult;
import github.sarthakdev143.film_factory.model.ErrorMessages;
import github.sarthakdev143.film_factory.model.GenerationJob;
import github.sarthakdev143.film_factory.model.JobStatus;
import github.sarthakdev143.film_factory.model.JobType;
import github.sarthakdev143.film_factory.ratelimit.RateLimiter;
import github.sarthakdev143.film_factory.ratelimit.RateLimiterRegistry;
import github.sarthakdev143.film_factory.retry.RetryExecutor;
import github.sarthakdev143.film_factory.service.DispatchedJob;
import github.sarthakdev143.film_factory.service.GenerationDispatcher;
import github.sarthakdev143.film_factory.service.GenerationWork;
import github.sarthakdev143.film_factory.service.JobContext;
import github.sarthakdev143.film_factory.service.WorkRetryPolicies;
import github.sarthakdev143.film_factory.store.JobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

public class DefaultGenerationDispatcher implements GenerationDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(DefaultGenerationDispatcher.class);

    private final JobStore jobStore;
    private final RateLimiterRegistry rateLimiters;
    private final RetryExecutor retryExecutor;
    private final WorkRetryPolicies retryPolicies;
    private final TaskExecutor taskExecutor;
    private final Map<String, CompletableFuture<GenerationJob>> completions = new ConcurrentHashMap<>();
    private final Counter submittedCounter;
    private final Counter deduplicatedCounter;
    private final Counter completedCounter;
    private final Counter failedCounter;

    public DefaultGenerationDispatcher(
            JobStore jobStore,
            RateLimiterRegistry rateLimiters,
            RetryExecutor retryExecutor,
            WorkRetryPolicies retryPolicies,
            TaskExecutor taskExecutor,
            MeterRegistry meterRegistry) {
        this.jobStore = jobStore;
        this.rateLimiters = rateLimiters;
        this.retryExecutor = retryExecutor;
        this.retryPolicies = retryPolicies;
        this.taskExecutor = taskExecutor;
        this.submittedCounter = meterRegistry.counter("film_factory.jobs.submitted");
        this.deduplicatedCounter = meterRegistry.counter("film_factory.jobs.deduplicated");
        this.completedCounter = meterRegistry.counter("film_factory.jobs.completed");
        this.failedCounter = meterRegistry.counter("film_factory.jobs.failed");
    }

    @Override
    public DispatchedJob submit(String ownerId, JobType jobType, String targetId, GenerationWork work) {
        if (work == null) {
            throw new IllegalArgumentException("work is required.");
        }

        Optional<RateLimiter> limiter = rateLimiters.find(jobType.resourceClass());
        JobStatus initialStatus = limiter.isPresent() ? JobStatus.QUEUED : JobStatus.GENERATING;
        CreateOrGetResult created = jobStore.createOrGet(ownerId, jobType, targetId, initialStatus);
        GenerationJob job = created.job();

        if (created.alreadyRunning()) {
            deduplicatedCounter.increment();
            logger.info("Returning in-flight job {} type={} targetId={} status={}",
                    job.id(), jobType.toApiValue(), targetId, job.status().toApiValue());
            return new DispatchedJob(job.id(), true);
        }

        submittedCounter.increment();
        completions.computeIfAbsent(job.id(), ignored -> new CompletableFuture<>());
        logger.info("Accepted job {} type={} ownerId={} targetId={} status={}",
                job.id(), jobType.toApiValue(), ownerId, targetId, initialStatus.toApiValue());

        schedule(job, () -> process(job, work, limiter.orElse(null)));
        return new DispatchedJob(job.id(), false);
    }

    @Override
    public void resume(GenerationJob job, GenerationWork work) {
        if (job.status() != JobStatus.GENERATING) {
            throw new IllegalArgumentException("Only generating jobs can be resumed, job " + job.id() + " is "
                    + job.status().toApiValue());
        }
        completions.computeIfAbsent(job.id(), ignored -> new CompletableFuture<>());
        logger.info("Resuming job {} type={} targetId={}", job.id(), job.jobType().toApiValue(), job.targetId());
        schedule(job, () -> process(job, work, null));
    }

    @Override
    public CompletableFuture<GenerationJob> completion(String jobId) {
        Optional<GenerationJob> current = jobStore.find(jobId);
        if (current.isEmpty()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Job not found: " + jobId));
        }
        if (current.get().status().isTerminal()) {
            return CompletableFuture.completedFuture(current.get());
        }

        CompletableFuture<GenerationJob> future = completions.computeIfAbsent(jobId, ignored -> new CompletableFuture<>());
        // The job may have finished between the read above and registering the future.
        jobStore.find(jobId)
                .filter(job -> job.status().isTerminal())
                .ifPresent(job -> {
                    completions.remove(jobId, future);
                    future.complete(job);
                });
        return future;
    }

    private void schedule(GenerationJob job, Runnable task) {
        try {
            taskExecutor.execute(task);
        } catch (TaskRejectedException e) {
            logger.error("Executor rejected job {}", job.id(), e);
            finish(job, JobStatus.FAILED, Map.of(), "Dispatcher is at capacity, try again later");
        }
    }

    private void process(GenerationJob job, GenerationWork work, RateLimiter limiter) {
        JobContext context = new StoreBackedJobContext(jobStore, job);
        RateLimiter.Permit permit = null;

        try {
            if (limiter != null) {
                permit = limiter.acquire(() -> jobStore.markGenerating(job.id()));
            }

            Map<String, Object> result = retryExecutor.run(
                    job.jobType().toApiValue() + " job " + job.id(),
                    () -> work.execute(context),
                    retryPolicies.forType(job.jobType()));
            finish(job, JobStatus.COMPLETED, result, null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finish(job, JobStatus.FAILED, Map.of(), "Interrupted");
        } catch (Exception e) {
            logger.error("Job {} type={} failed", job.id(), job.jobType().toApiValue(), e);
            finish(job, JobStatus.FAILED, Map.of(), ErrorMessages.describe(e));
        } finally {
            if (permit != null) {
                permit.close();
            }
        }
    }

    private void finish(GenerationJob job, JobStatus status, Map<String, Object> result, String errorMessage) {
        try {
            boolean written = jobStore.update(job.id(), status, result == null ? Map.of() : result, errorMessage);
            if (written) {
                (status == JobStatus.COMPLETED ? completedCounter : failedCounter).increment();
                logger.info("Job {} finished status={}", job.id(), status.toApiValue());
            }
        } catch (RuntimeException storeError) {
            logger.error("Could not persist terminal state for job {} status={}", job.id(), status.toApiValue(), storeError);
        }

        CompletableFuture<GenerationJob> future = completions.remove(job.id());
        if (future != null) {
            GenerationJob terminal = findQuietly(job.id()).orElseGet(() -> new GenerationJob(
                    job.id(),
                    job.ownerId(),
                    job.jobType(),
                    job.targetId(),
                    status,
                    result,
                    ErrorMessages.truncate(errorMessage),
                    job.createdAt(),
                    job.updatedAt()));
            future.complete(terminal);
        }
    }

    private Optional<GenerationJob> findQuietly(String jobId) {
        try {
            return jobStore.find(jobId).filter(job -> job.status().isTerminal());
        } catch (RuntimeException e) {
            logger.warn("Could not reload job {} after completion: {}", jobId, e.getMessage());
            return Optional.empty();
        }
    }
}
