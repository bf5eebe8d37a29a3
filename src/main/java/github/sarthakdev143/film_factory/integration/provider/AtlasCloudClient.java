package github.sarthakdev143.film_factory.integration.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.film_factory.config.FilmFactoryProperties;
import github.sarthakdev143.film_factory.model.ProviderPrediction;
import github.sarthakdev143.film_factory.retry.ErrorKind;
import github.sarthakdev143.film_factory.retry.ProviderCallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * HTTP access to the Atlas Cloud prediction API shared by the image and video adapters.
 */
public class AtlasCloudClient {

    private static final Logger logger = LoggerFactory.getLogger(AtlasCloudClient.class);
    static final String PREDICTION_PATH = "/model/prediction/{predictionId}";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final Duration requestTimeout;

    public AtlasCloudClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper, FilmFactoryProperties.Atlas atlas) {
        this.webClient = webClientBuilder
                .baseUrl(atlas.baseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.objectMapper = objectMapper;
        this.apiKey = atlas.apiKey();
        this.requestTimeout = atlas.requestTimeout();
    }

    /**
     * @return the provider's prediction id
     */
    public String submit(String path, Map<String, Object> body) {
        String response = call("submit " + path, webClient.post()
                .uri(path)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class));

        String predictionId = readTree(response).path("data").path("id").asText("");
        if (predictionId.isBlank()) {
            throw new ProviderCallException("Atlas submit response had no prediction id", ErrorKind.PERMANENT);
        }
        return predictionId;
    }

    public ProviderPrediction fetchPrediction(String predictionId) {
        String response = call("poll " + predictionId, webClient.get()
                .uri(PREDICTION_PATH, predictionId)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .bodyToMono(String.class));
        return parsePrediction(readTree(response));
    }

    ProviderPrediction parsePrediction(JsonNode root) {
        JsonNode data = root.path("data");
        String status = data.path("status").asText("").toLowerCase(Locale.ROOT);

        switch (status) {
            case "completed", "succeeded" -> {
                JsonNode outputs = data.path("outputs");
                if (!outputs.isArray() || outputs.isEmpty() || outputs.get(0).asText("").isBlank()) {
                    return ProviderPrediction.failed("Provider reported success without an output");
                }
                return ProviderPrediction.completed(outputs.get(0).asText());
            }
            case "failed" -> {
                String error = data.path("error").asText("");
                return ProviderPrediction.failed(error.isBlank() ? "Generation failed" : error);
            }
            default -> {
                return ProviderPrediction.pending();
            }
        }
    }

    private String call(String operation, Mono<String> request) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderCallException("ATLASCLOUD_API_KEY is not configured", ErrorKind.PERMANENT);
        }
        try {
            String response = request.timeout(requestTimeout).block();
            if (response == null || response.isBlank()) {
                throw new ProviderCallException("Atlas returned an empty body for " + operation, ErrorKind.TRANSIENT);
            }
            return response;
        } catch (WebClientResponseException e) {
            logger.warn("Atlas HTTP error operation={} statusCode={} statusText={}",
                    operation, e.getStatusCode().value(), e.getStatusText());
            throw mapException(e);
        } catch (WebClientRequestException e) {
            throw new ProviderCallException("Atlas request failed: " + e.getMessage(), ErrorKind.TRANSIENT, 0, e);
        } catch (ProviderCallException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new ProviderCallException(
                        "Atlas " + operation + " timed out after " + requestTimeout.toSeconds() + "s",
                        ErrorKind.TRANSIENT,
                        0,
                        cause);
            }
            throw e;
        }
    }

    ProviderCallException mapException(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        // 429 and 5xx are worth retrying; other 4xx mean the request itself is wrong.
        ErrorKind kind = status == 429 || status >= 500 ? ErrorKind.TRANSIENT : ErrorKind.PERMANENT;
        String message = String.format(Locale.ROOT, "Atlas API error: %d %s", status, e.getStatusText());

        try {
            JsonNode body = objectMapper.readTree(e.getResponseBodyAsString());
            String detail = body.path("message").asText(body.path("error").asText(""));
            if (!detail.isBlank()) {
                message = message + ": " + detail;
            }
        } catch (Exception parseError) {
            logger.debug("Atlas error body was not JSON statusCode={}", status);
        }

        return new ProviderCallException(message, kind, status, e);
    }

    private JsonNode readTree(String response) {
        try {
            return objectMapper.readTree(response);
        } catch (Exception e) {
            throw new ProviderCallException("Failed to parse Atlas response", ErrorKind.PERMANENT, 0, e);
        }
    }

    private String bearer() {
        return "Bearer " + apiKey;
    }
}
