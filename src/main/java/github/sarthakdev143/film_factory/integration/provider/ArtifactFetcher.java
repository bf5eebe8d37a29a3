package github.sarthakdev143.film_factory.integration.provider;

import github.sarthakdev143.film_factory.model.GeneratedArtifact;
import github.sarthakdev143.film_factory.retry.ErrorKind;
import github.sarthakdev143.film_factory.retry.ProviderCallException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.URI;
import java.time.Duration;

/**
 * Downloads a provider output before it expires on the provider side.
 */
public class ArtifactFetcher {

    private static final int MAX_ARTIFACT_BYTES = 256 * 1024 * 1024;

    private final WebClient webClient;
    private final Duration timeout;

    public ArtifactFetcher(WebClient.Builder webClientBuilder, Duration timeout) {
        this.webClient = webClientBuilder
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_ARTIFACT_BYTES))
                .build();
        this.timeout = timeout;
    }

    public GeneratedArtifact fetch(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Artifact url is required.");
        }
        try {
            ResponseEntity<byte[]> response = webClient.get()
                    .uri(URI.create(url))
                    .retrieve()
                    .toEntity(byte[].class)
                    .timeout(timeout)
                    .block();
            if (response == null || response.getBody() == null || response.getBody().length == 0) {
                throw new ProviderCallException("Downloaded artifact was empty", ErrorKind.TRANSIENT);
            }
            MediaType contentType = response.getHeaders().getContentType();
            return new GeneratedArtifact(
                    response.getBody(),
                    contentType == null ? MediaType.APPLICATION_OCTET_STREAM_VALUE : contentType.toString(),
                    url);
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            ErrorKind kind = status == 429 || status >= 500 ? ErrorKind.TRANSIENT : ErrorKind.PERMANENT;
            throw new ProviderCallException("Artifact download failed with HTTP " + status, kind, status, e);
        } catch (WebClientRequestException e) {
            throw new ProviderCallException("Artifact download failed: " + e.getMessage(), ErrorKind.TRANSIENT, 0, e);
        }
    }
}
