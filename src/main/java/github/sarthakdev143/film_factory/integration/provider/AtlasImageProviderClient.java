package github.sarthakdev143.film_factory.integration.provider;

import github.sarthakdev143.film_factory.config.FilmFactoryProperties;
import github.sarthakdev143.film_factory.model.GeneratedArtifact;
import github.sarthakdev143.film_factory.model.GenerationRequest;
import github.sarthakdev143.film_factory.model.ProviderPrediction;
import github.sarthakdev143.film_factory.retry.ErrorKind;
import github.sarthakdev143.film_factory.retry.ProviderCallException;
import github.sarthakdev143.film_factory.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keyframe generation. Atlas image predictions finish within seconds, so this adapter waits for
 * the output itself and returns the downloaded image.
 */
public class AtlasImageProviderClient implements SyncGenerationProvider {

    private static final Logger logger = LoggerFactory.getLogger(AtlasImageProviderClient.class);
    static final String GENERATE_PATH = "/model/generateImage";
    static final Duration POLL_INTERVAL = Duration.ofSeconds(2);
    static final Duration MAX_WAIT = Duration.ofMinutes(2);

    private final AtlasCloudClient client;
    private final ArtifactFetcher fetcher;
    private final FilmFactoryProperties.Atlas atlas;
    private final Sleeper sleeper;
    private final Clock clock;

    public AtlasImageProviderClient(
            AtlasCloudClient client,
            ArtifactFetcher fetcher,
            FilmFactoryProperties.Atlas atlas,
            Sleeper sleeper,
            Clock clock) {
        this.client = client;
        this.fetcher = fetcher;
        this.atlas = atlas;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "atlas-image";
    }

    @Override
    public GeneratedArtifact generate(GenerationRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", atlas.imageModel());
        body.put("prompt", request.prompt());
        body.put("aspect_ratio", atlas.aspectRatio());

        String predictionId = client.submit(GENERATE_PATH, body);
        Instant deadline = clock.instant().plus(MAX_WAIT);

        while (true) {
            pause();
            ProviderPrediction prediction = client.fetchPrediction(predictionId);
            switch (prediction.state()) {
                case COMPLETED -> {
                    logger.info("Image prediction completed predictionId={}", predictionId);
                    return fetcher.fetch(prediction.outputUrl());
                }
                case FAILED -> throw new ProviderCallException(
                        "Image generation failed: " + prediction.error(), ErrorKind.PERMANENT);
                case PENDING -> {
                    if (!clock.instant().isBefore(deadline)) {
                        throw new ProviderCallException(
                                "Image generation timed out after " + MAX_WAIT.toSeconds() + "s", ErrorKind.TRANSIENT);
                    }
                }
            }
        }
    }

    private void pause() {
        try {
            sleeper.sleep(POLL_INTERVAL);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ProviderCallException.permanentError("Image generation was interrupted", e);
        }
    }
}
