package github.sarthakdev143.film_factory.model;

import java.util.Map;

/**
 * Provider-agnostic request. Provider adapters read the options they understand.
 */
public record GenerationRequest(String prompt, String imageUrl, Map<String, Object> options) {

    public GenerationRequest {
        options = options == null ? Map.of() : Map.copyOf(options);
    }
}
