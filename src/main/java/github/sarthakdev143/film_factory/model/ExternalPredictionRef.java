package github.sarthakdev143.film_factory.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Correlation id of a submit/poll provider call, stored in a job result while the job is in flight.
 * A job without one cannot be resumed after a restart.
 */
public record ExternalPredictionRef(String predictionId, String ownerId, String targetId, String provider) {

    public static final String PREDICTION_ID = "prediction_id";
    public static final String OWNER_ID = "owner_id";
    public static final String TARGET_ID = "target_id";
    public static final String PROVIDER = "provider";

    public ExternalPredictionRef {
        if (predictionId == null || predictionId.isBlank()) {
            throw new IllegalArgumentException("predictionId must not be blank.");
        }
    }

    public Map<String, Object> toResult() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(PREDICTION_ID, predictionId);
        result.put(OWNER_ID, ownerId);
        result.put(TARGET_ID, targetId);
        if (provider != null) {
            result.put(PROVIDER, provider);
        }
        return result;
    }

    public static Optional<ExternalPredictionRef> fromResult(Map<String, Object> result) {
        if (result == null) {
            return Optional.empty();
        }
        Object predictionId = result.get(PREDICTION_ID);
        if (!(predictionId instanceof String id) || id.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new ExternalPredictionRef(
                id,
                asString(result.get(OWNER_ID)),
                asString(result.get(TARGET_ID)),
                asString(result.get(PROVIDER))));
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
