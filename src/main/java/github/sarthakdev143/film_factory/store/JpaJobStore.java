package github.sarthakdev143.film_factory.store;

import github.sarthakdev143.film_factory.model.CreateOrGetResult;
import github.sarthakdev143.film_factory.model.ErrorMessages;
import github.sarthakdev143.film_factory.model.GenerationJob;
import github.sarthakdev143.film_factory.model.JobStatus;
import github.sarthakdev143.film_factory.model.JobType;
import github.sarthakdev143.film_factory.retry.ProviderCallException;
import github.sarthakdev143.film_factory.store.entity.GenerationJobEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public class JpaJobStore implements JobStore {

    private static final Logger logger = LoggerFactory.getLogger(JpaJobStore.class);

    private final GenerationJobRepository repository;
    private final StoreOperations operations;
    private final Clock clock;

    public JpaJobStore(GenerationJobRepository repository, StoreOperations operations, Clock clock) {
        this.repository = repository;
        this.operations = operations;
        this.clock = clock;
    }

    @Override
    public CreateOrGetResult createOrGet(String ownerId, JobType jobType, String targetId, JobStatus initialStatus) {
        requireText(ownerId, "ownerId");
        requireText(targetId, "targetId");
        if (jobType == null) {
            throw new IllegalArgumentException("jobType is required.");
        }
        if (initialStatus == null || initialStatus.isTerminal()) {
            throw new IllegalArgumentException("initialStatus must be queued or generating.");
        }

        String activeKey = activeKey(ownerId, jobType, targetId);
        return operations.retried("createOrGet " + jobType.toApiValue(), () -> {
            try {
                return operations.transactionTemplate().execute(status -> {
                    Optional<GenerationJobEntity> existing = repository.findByActiveKey(activeKey);
                    if (existing.isPresent()) {
                        return new CreateOrGetResult(toModel(existing.get()), true);
                    }
                    GenerationJobEntity created = new GenerationJobEntity(
                            UUID.randomUUID().toString(),
                            ownerId,
                            jobType,
                            targetId,
                            initialStatus,
                            activeKey,
                            clock.instant());
                    repository.saveAndFlush(created);
                    return new CreateOrGetResult(toModel(created), false);
                });
            } catch (DataIntegrityViolationException race) {
                GenerationJobEntity winner = operations.transactionTemplate()
                        .execute(status -> repository.findByActiveKey(activeKey).orElse(null));
                if (winner == null) {
                    // The concurrent job finished between the two reads; try again.
                    throw ProviderCallException.transientError("Concurrent job for " + targetId + " already finished", race);
                }
                logger.debug("Concurrent create lost to existing job. jobId={}, targetId={}", winner.getId(), targetId);
                return new CreateOrGetResult(toModel(winner), true);
            }
        });
    }

    @Override
    public void markGenerating(String jobId) {
        operations.inTransaction("markGenerating", () -> {
            GenerationJobEntity entity = lockedJob(jobId);
            if (entity.getStatus() == JobStatus.QUEUED) {
                entity.setStatus(JobStatus.GENERATING);
                touch(entity);
            }
            return null;
        });
    }

    @Override
    public void recordProgress(String jobId, Map<String, Object> result) {
        operations.inTransaction("recordProgress", () -> {
            GenerationJobEntity entity = lockedJob(jobId);
            if (entity.getStatus().isTerminal()) {
                logger.warn("Ignoring progress for terminal job. jobId={}, status={}", jobId, entity.getStatus());
                return null;
            }
            entity.setResult(result == null ? Map.of() : Map.copyOf(result));
            touch(entity);
            return null;
        });
    }

    @Override
    public boolean update(String jobId, JobStatus status, Map<String, Object> result, String errorMessage) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("update only accepts a terminal status, got " + status);
        }
        return operations.inTransaction("update", () -> {
            GenerationJobEntity entity = lockedJob(jobId);
            if (entity.getStatus().isTerminal()) {
                logger.warn("Rejected second terminal write. jobId={}, currentStatus={}, attemptedStatus={}",
                        jobId, entity.getStatus(), status);
                return false;
            }
            entity.setStatus(status);
            entity.setResult(result == null ? Map.of() : Map.copyOf(result));
            entity.setErrorMessage(ErrorMessages.truncate(errorMessage));
            entity.setActiveKey(null);
            touch(entity);
            return true;
        });
    }

    @Override
    public void heartbeat(String jobId) {
        operations.inTransaction("heartbeat", () -> {
            GenerationJobEntity entity = lockedJob(jobId);
            if (!entity.getStatus().isTerminal()) {
                touch(entity);
            }
            return null;
        });
    }

    @Override
    public Optional<GenerationJob> find(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            return Optional.empty();
        }
        return operations.inTransaction("find", () -> repository.findById(jobId).map(JpaJobStore::toModel));
    }

    @Override
    public List<GenerationJob> listStale(JobStatus status, Instant olderThan, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return operations.inTransaction("listStale", () -> repository
                .findByStatusAndUpdatedAtBeforeOrderByUpdatedAtAsc(status, olderThan, PageRequest.of(0, limit))
                .stream()
                .map(JpaJobStore::toModel)
                .toList());
    }

    @Override
    public List<GenerationJob> listBy(JobStatus status, JobType jobType) {
        return operations.inTransaction("listBy", () -> {
            List<GenerationJobEntity> rows = jobType == null
                    ? repository.findByStatusOrderByCreatedAtAsc(status)
                    : repository.findByStatusAndJobTypeOrderByCreatedAtAsc(status, jobType);
            return rows.stream().map(JpaJobStore::toModel).toList();
        });
    }

    static String activeKey(String ownerId, JobType jobType, String targetId) {
        return ownerId + "|" + jobType.name() + "|" + targetId;
    }

    private GenerationJobEntity lockedJob(String jobId) {
        return repository.findForUpdate(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Job not found: " + jobId));
    }

    private void touch(GenerationJobEntity entity) {
        Instant now = clock.instant();
        entity.setUpdatedAt(now.isBefore(entity.getUpdatedAt()) ? entity.getUpdatedAt() : now);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required.");
        }
    }

    static GenerationJob toModel(GenerationJobEntity entity) {
        return new GenerationJob(
                entity.getId(),
                entity.getOwnerId(),
                entity.getJobType(),
                entity.getTargetId(),
                entity.getStatus(),
                entity.getResult(),
                entity.getErrorMessage(),
                entity.getCreatedAt(),
                entity.getUpdatedAt());
    }
}
