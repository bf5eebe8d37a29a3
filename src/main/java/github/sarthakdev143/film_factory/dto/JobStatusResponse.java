package github.sarthakdev143.film_factory.dto;

import github.sarthakdev143.film_factory.model.GenerationJob;

import java.time.Instant;
import java.util.Map;

public record JobStatusResponse(
        String jobId,
        String ownerId,
        String jobType,
        String targetId,
        String status,
        Map<String, Object> result,
        String errorMessage,
        Instant createdAt,
        Instant updatedAt) {

    public static JobStatusResponse from(GenerationJob job) {
        return new JobStatusResponse(
                job.id(),
                job.ownerId(),
                job.jobType().toApiValue(),
                job.targetId(),
                job.status().toApiValue(),
                job.result(),
                job.errorMessage(),
                job.createdAt(),
                job.updatedAt());
    }
}
