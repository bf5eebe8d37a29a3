package github.sarthakdev143.film_factory.model;

/**
 * Input for one shot of a film. When {@code referenceImageUrl} is null a keyframe is generated first.
 */
public record ShotSpec(
        int number,
        String prompt,
        String referenceImageUrl,
        int durationSeconds) {

    public static final int DEFAULT_DURATION_SECONDS = 8;

    public ShotSpec {
        if (number < 1) {
            throw new IllegalArgumentException("Shot number must be at least 1.");
        }
        durationSeconds = durationSeconds <= 0 ? DEFAULT_DURATION_SECONDS : durationSeconds;
        referenceImageUrl = referenceImageUrl == null || referenceImageUrl.isBlank() ? null : referenceImageUrl;
    }

    public boolean needsKeyframe() {
        return referenceImageUrl == null;
    }
}
