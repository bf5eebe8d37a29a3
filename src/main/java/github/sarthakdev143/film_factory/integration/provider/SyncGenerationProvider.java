package github.sarthakdev143.film_factory.integration.provider;

import github.sarthakdev143.film_factory.model.GeneratedArtifact;
import github.sarthakdev143.film_factory.model.GenerationRequest;

/**
 * Provider that returns the finished artifact from a single call.
 */
public interface SyncGenerationProvider {

    String name();

    GeneratedArtifact generate(GenerationRequest request);
}
