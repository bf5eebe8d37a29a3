package github.sarthakdev143.film_factory.integration.provider;

import github.sarthakdev143.film_factory.model.GeneratedArtifact;
import github.sarthakdev143.film_factory.model.GenerationRequest;
import github.sarthakdev143.film_factory.model.ProviderPrediction;
import github.sarthakdev143.film_factory.retry.ProviderCallException;
import github.sarthakdev143.film_factory.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AtlasImageProviderClientTest {

    private static final GenerationRequest REQUEST = new GenerationRequest("a lighthouse at dusk", null, Map.of());

    @Mock
    private AtlasCloudClient atlasCloudClient;

    @Mock
    private ArtifactFetcher fetcher;

    private MutableClock clock;
    private AtlasImageProviderClient provider;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        provider = new AtlasImageProviderClient(atlasCloudClient, fetcher, AtlasCloudClientTest.atlas("k"), clock::advance, clock);
    }

    @Test
    void generateWaitsForOutputAndDownloadsIt() {
        GeneratedArtifact image = new GeneratedArtifact(new byte[] {1, 2, 3}, "image/png", "https://cdn.example/k.png");
        when(atlasCloudClient.submit(eq("/model/generateImage"), anyMap())).thenReturn("img-1");
        when(atlasCloudClient.fetchPrediction("img-1")).thenReturn(
                ProviderPrediction.pending(),
                ProviderPrediction.completed("https://cdn.example/k.png"));
        when(fetcher.fetch("https://cdn.example/k.png")).thenReturn(image);

        GeneratedArtifact generated = provider.generate(REQUEST);

        assertThat(generated).isSameAs(image);
        assertThat(clock.instant()).isEqualTo(Instant.parse("2026-03-01T10:00:04Z"));
    }

    @Test
    void generateFailsWhenProviderRejectsPrompt() {
        when(atlasCloudClient.submit(eq("/model/generateImage"), anyMap())).thenReturn("img-2");
        when(atlasCloudClient.fetchPrediction("img-2")).thenReturn(ProviderPrediction.failed("blocked prompt"));

        assertThatThrownBy(() -> provider.generate(REQUEST))
                .isInstanceOf(ProviderCallException.class)
                .hasMessage("Image generation failed: blocked prompt");
        verify(fetcher, never()).fetch(anyString());
    }

    @Test
    void generateTimesOutWhenImageNeverArrives() {
        when(atlasCloudClient.submit(eq("/model/generateImage"), anyMap())).thenReturn("img-3");
        when(atlasCloudClient.fetchPrediction("img-3")).thenReturn(ProviderPrediction.pending());

        assertThatThrownBy(() -> provider.generate(REQUEST))
                .isInstanceOf(ProviderCallException.class)
                .hasMessage("Image generation timed out after 120s")
                .satisfies(error -> assertThat(((ProviderCallException) error).isTransient()).isTrue());
    }
}
