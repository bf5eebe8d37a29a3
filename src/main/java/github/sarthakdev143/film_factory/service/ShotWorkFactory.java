package github.sarthakdev143.film_factory.service;

import github.sarthakdev143.film_factory.integration.provider.AtlasVideoProviderClient;
import github.sarthakdev143.film_factory.integration.provider.PredictionPoller;
import github.sarthakdev143.film_factory.integration.provider.ProviderRegistry;
import github.sarthakdev143.film_factory.model.ExternalPredictionRef;
import github.sarthakdev143.film_factory.model.GeneratedArtifact;
import github.sarthakdev143.film_factory.model.GenerationRequest;
import github.sarthakdev143.film_factory.model.JobType;
import github.sarthakdev143.film_factory.model.ShotSpec;

import java.util.Map;

/**
 * Builds the units of work dispatched for one shot: the keyframe image and the video clip.
 */
public class ShotWorkFactory {

    static final String KEYFRAME_PREFIX = "keyframes";
    static final String CLIP_PREFIX = "clips";

    private final ProviderRegistry providers;
    private final PredictionPoller poller;
    private final ArtifactPersister persister;

    public ShotWorkFactory(ProviderRegistry providers, PredictionPoller poller, ArtifactPersister persister) {
        this.providers = providers;
        this.poller = poller;
        this.persister = persister;
    }

    public GenerationWork keyframe(ShotSpec shot) {
        return context -> {
            GeneratedArtifact image = providers.syncFor(JobType.IMAGE)
                    .generate(new GenerationRequest(shot.prompt(), null, Map.of()));
            return persister.store(KEYFRAME_PREFIX, image);
        };
    }

    public GenerationWork clip(ShotSpec shot, String firstFrameUrl) {
        return context -> {
            GenerationRequest request = new GenerationRequest(
                    shot.prompt(),
                    firstFrameUrl,
                    Map.of(AtlasVideoProviderClient.OPTION_DURATION, shot.durationSeconds()));
            String outputUrl = poller.submitAndAwait(providers.asyncFor(JobType.CLIP), request, context);
            return persister.persistFromUrl(CLIP_PREFIX, outputUrl);
        };
    }

    /**
     * Poll-only work for a job whose prediction was submitted by a previous process.
     */
    public GenerationWork resumePolling(JobType jobType, ExternalPredictionRef ref) {
        return context -> {
            String outputUrl = poller.await(providers.asyncFor(jobType), ref.predictionId(), context);
            return persister.persistFromUrl(prefixFor(jobType), outputUrl);
        };
    }

    public static String prefixFor(JobType jobType) {
        return switch (jobType) {
            case CLIP -> CLIP_PREFIX;
            case IMAGE -> KEYFRAME_PREFIX;
            default -> jobType.toApiValue();
        };
    }
}
