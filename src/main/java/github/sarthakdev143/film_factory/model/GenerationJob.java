package github.sarthakdev143.film_factory.model;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of one persisted unit of work.
 */
public record GenerationJob(
        String id,
        String ownerId,
        JobType jobType,
        String targetId,
        JobStatus status,
        Map<String, Object> result,
        String errorMessage,
        Instant createdAt,
        Instant updatedAt) {

    public GenerationJob {
        result = result == null ? Map.of() : Map.copyOf(result);
    }

    public Optional<ExternalPredictionRef> predictionRef() {
        return ExternalPredictionRef.fromResult(result);
    }
}
