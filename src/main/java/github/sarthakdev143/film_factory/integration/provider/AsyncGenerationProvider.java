package github.sarthakdev143.film_factory.integration.provider;

import github.sarthakdev143.film_factory.model.GenerationRequest;
import github.sarthakdev143.film_factory.model.ProviderPrediction;

/**
 * Provider with a submit/poll contract. The prediction id returned by {@link #submit} is enough to
 * poll the job again from a different process.
 */
public interface AsyncGenerationProvider {

    String name();

    String submit(GenerationRequest request);

    ProviderPrediction poll(String predictionId);
}
