package github.sarthakdev143.film_factory.integration.provider;

import github.sarthakdev143.film_factory.model.GenerationRequest;
import github.sarthakdev143.film_factory.model.ProviderPrediction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AtlasVideoProviderClientTest {

    @Mock
    private AtlasCloudClient atlasCloudClient;

    @Test
    void submitSendsImageToVideoRequest() {
        AtlasVideoProviderClient provider = new AtlasVideoProviderClient(atlasCloudClient, AtlasCloudClientTest.atlas("k"));
        when(atlasCloudClient.submit(eq("/model/generateVideo"), anyMap())).thenReturn("pred-9");

        String predictionId = provider.submit(new GenerationRequest(
                "a lighthouse at dusk", "https://cdn.example/k.png", Map.of(AtlasVideoProviderClient.OPTION_DURATION, 6)));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> body = ArgumentCaptor.forClass(Map.class);
        verify(atlasCloudClient).submit(eq("/model/generateVideo"), body.capture());
        assertThat(predictionId).isEqualTo("pred-9");
        assertThat(body.getValue())
                .containsEntry("model", "video-model")
                .containsEntry("prompt", "a lighthouse at dusk")
                .containsEntry("image", "https://cdn.example/k.png")
                .containsEntry("duration", 6)
                .containsEntry("aspect_ratio", "9:16")
                .containsEntry("resolution", "720p");
    }

    @Test
    void submitDefaultsDurationToEightSeconds() {
        AtlasVideoProviderClient provider = new AtlasVideoProviderClient(atlasCloudClient, AtlasCloudClientTest.atlas("k"));
        when(atlasCloudClient.submit(eq("/model/generateVideo"), anyMap())).thenReturn("pred-10");

        provider.submit(new GenerationRequest("fog", "https://cdn.example/f.png", Map.of()));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> body = ArgumentCaptor.forClass(Map.class);
        verify(atlasCloudClient).submit(eq("/model/generateVideo"), body.capture());
        assertThat(body.getValue()).containsEntry("duration", 8);
    }

    @Test
    void submitRequiresFirstFrame() {
        AtlasVideoProviderClient provider = new AtlasVideoProviderClient(atlasCloudClient, AtlasCloudClientTest.atlas("k"));

        assertThatThrownBy(() -> provider.submit(new GenerationRequest("fog", null, Map.of())))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(atlasCloudClient);
    }

    @Test
    void pollDelegatesToPredictionEndpoint() {
        AtlasVideoProviderClient provider = new AtlasVideoProviderClient(atlasCloudClient, AtlasCloudClientTest.atlas("k"));
        when(atlasCloudClient.fetchPrediction("pred-1")).thenReturn(ProviderPrediction.pending());

        assertThat(provider.poll("pred-1").state()).isEqualTo(ProviderPrediction.State.PENDING);
    }
}
