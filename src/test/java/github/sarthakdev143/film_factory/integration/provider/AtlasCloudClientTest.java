package github.sarthakdev143.film_factory.integration.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.film_factory.config.FilmFactoryProperties;
import github.sarthakdev143.film_factory.model.ProviderPrediction;
import github.sarthakdev143.film_factory.retry.ProviderCallException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AtlasCloudClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<ClientRequest> requests = new ArrayList<>();

    @Test
    void submitReturnsPredictionIdAndSendsBearerToken() {
        AtlasCloudClient client = client("test-key", HttpStatus.OK, "{\"code\":200,\"data\":{\"id\":\"pred-42\"}}");

        String predictionId = client.submit("/model/generateVideo", Map.of("prompt", "waves"));

        assertThat(predictionId).isEqualTo("pred-42");
        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).url().getPath()).isEqualTo("/api/v1/model/generateVideo");
        assertThat(requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer test-key");
    }

    @Test
    void submitFailsPermanentlyWithoutPredictionId() {
        AtlasCloudClient client = client("test-key", HttpStatus.OK, "{\"data\":{}}");

        assertThatThrownBy(() -> client.submit("/model/generateVideo", Map.of()))
                .isInstanceOf(ProviderCallException.class)
                .hasMessage("Atlas submit response had no prediction id");
    }

    @Test
    void fetchPredictionReadsCompletedOutput() {
        AtlasCloudClient client = client("test-key", HttpStatus.OK,
                "{\"data\":{\"status\":\"completed\",\"outputs\":[\"https://cdn.example/out.mp4\"]}}");

        ProviderPrediction prediction = client.fetchPrediction("pred-42");

        assertThat(prediction).isEqualTo(ProviderPrediction.completed("https://cdn.example/out.mp4"));
        assertThat(requests.get(0).url().getPath()).isEqualTo("/api/v1/model/prediction/pred-42");
    }

    @Test
    void parsePredictionMapsProviderStates() throws Exception {
        AtlasCloudClient client = client("test-key", HttpStatus.OK, "{}");

        assertThat(client.parsePrediction(objectMapper.readTree("{\"data\":{\"status\":\"processing\"}}")).state())
                .isEqualTo(ProviderPrediction.State.PENDING);
        assertThat(client.parsePrediction(objectMapper.readTree(
                "{\"data\":{\"status\":\"SUCCEEDED\",\"outputs\":[\"https://cdn.example/a.png\"]}}")).outputUrl())
                .isEqualTo("https://cdn.example/a.png");
        assertThat(client.parsePrediction(objectMapper.readTree("{\"data\":{\"status\":\"failed\",\"error\":\"nsfw\"}}")))
                .isEqualTo(ProviderPrediction.failed("nsfw"));
        assertThat(client.parsePrediction(objectMapper.readTree("{\"data\":{\"status\":\"completed\",\"outputs\":[]}}"))
                .state()).isEqualTo(ProviderPrediction.State.FAILED);
    }

    @Test
    void rateLimitResponseIsTransient() {
        AtlasCloudClient client = client("test-key", HttpStatus.TOO_MANY_REQUESTS, "{\"message\":\"slow down\"}");

        assertThatThrownBy(() -> client.fetchPrediction("pred-1"))
                .isInstanceOf(ProviderCallException.class)
                .hasMessageContaining("429")
                .hasMessageContaining("slow down")
                .satisfies(error -> {
                    ProviderCallException providerError = (ProviderCallException) error;
                    assertThat(providerError.isTransient()).isTrue();
                    assertThat(providerError.isRateLimited()).isTrue();
                });
    }

    @Test
    void serverErrorIsTransient() {
        AtlasCloudClient client = client("test-key", HttpStatus.SERVICE_UNAVAILABLE, "upstream down");

        assertThatThrownBy(() -> client.fetchPrediction("pred-1"))
                .isInstanceOf(ProviderCallException.class)
                .satisfies(error -> assertThat(((ProviderCallException) error).isTransient()).isTrue());
    }

    @Test
    void badRequestIsPermanent() {
        AtlasCloudClient client = client("test-key", HttpStatus.BAD_REQUEST, "{\"error\":\"duration must be 4-12\"}");

        assertThatThrownBy(() -> client.submit("/model/generateVideo", Map.of()))
                .isInstanceOf(ProviderCallException.class)
                .hasMessageContaining("duration must be 4-12")
                .satisfies(error -> {
                    ProviderCallException providerError = (ProviderCallException) error;
                    assertThat(providerError.isTransient()).isFalse();
                    assertThat(providerError.statusCode()).isEqualTo(400);
                });
    }

    @Test
    void missingApiKeyFailsWithoutCallingProvider() {
        AtlasCloudClient client = client(" ", HttpStatus.OK, "{}");

        assertThatThrownBy(() -> client.fetchPrediction("pred-1"))
                .isInstanceOf(ProviderCallException.class)
                .hasMessage("ATLASCLOUD_API_KEY is not configured");
        assertThat(requests).isEmpty();
    }

    private AtlasCloudClient client(String apiKey, HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        });
        return new AtlasCloudClient(builder, objectMapper, atlas(apiKey));
    }

    static FilmFactoryProperties.Atlas atlas(String apiKey) {
        return new FilmFactoryProperties.Atlas(
                "https://atlas.test/api/v1",
                apiKey,
                "video-model",
                "image-model",
                "9:16",
                "720p",
                Duration.ofSeconds(5));
    }
}
