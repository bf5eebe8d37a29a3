package github.sarthakdev143.film_factory.integration.provider;

import github.sarthakdev143.film_factory.config.FilmFactoryProperties;
import github.sarthakdev143.film_factory.model.GenerationRequest;
import github.sarthakdev143.film_factory.model.ProviderPrediction;
import github.sarthakdev143.film_factory.model.ShotSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Image-to-video generation on Atlas Cloud.
 */
public class AtlasVideoProviderClient implements AsyncGenerationProvider {

    private static final Logger logger = LoggerFactory.getLogger(AtlasVideoProviderClient.class);
    static final String GENERATE_PATH = "/model/generateVideo";
    public static final String OPTION_DURATION = "duration";

    private final AtlasCloudClient client;
    private final FilmFactoryProperties.Atlas atlas;

    public AtlasVideoProviderClient(AtlasCloudClient client, FilmFactoryProperties.Atlas atlas) {
        this.client = client;
        this.atlas = atlas;
    }

    @Override
    public String name() {
        return "atlas-video";
    }

    @Override
    public String submit(GenerationRequest request) {
        if (request.imageUrl() == null || request.imageUrl().isBlank()) {
            throw new IllegalArgumentException("Video generation needs a first-frame image.");
        }
        Object duration = request.options().getOrDefault(OPTION_DURATION, ShotSpec.DEFAULT_DURATION_SECONDS);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", atlas.videoModel());
        body.put("prompt", request.prompt());
        body.put("image", request.imageUrl());
        body.put("duration", duration);
        body.put("aspect_ratio", atlas.aspectRatio());
        body.put("camera_fixed", false);
        body.put("generate_audio", true);
        body.put("resolution", atlas.resolution());
        body.put("seed", -1);

        String predictionId = client.submit(GENERATE_PATH, body);
        logger.info("Submitted video prediction predictionId={} duration={}s aspectRatio={}",
                predictionId, duration, atlas.aspectRatio());
        return predictionId;
    }

    @Override
    public ProviderPrediction poll(String predictionId) {
        return client.fetchPrediction(predictionId);
    }
}
