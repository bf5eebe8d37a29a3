package github.sarthakdev143.film_factory.config;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

@Component
@Order(0)
@ConditionalOnProperty(name = "film-factory.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final String FFMPEG_PATH_ENV = "FFMPEG_PATH";
    private static final String DEFAULT_FFMPEG_BINARY = "ffmpeg";
    private static final String API_KEY_ENV = "ATLASCLOUD_API_KEY";
    private static final int FFMPEG_CHECK_TIMEOUT_SECONDS = 10;

    private final FilmFactoryProperties properties;

    public StartupPreflightChecks(FilmFactoryProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkFfmpegConfiguration();
        checkProviderKey();
        checkStorageRoot();
    }

    private void checkFfmpegConfiguration() {
        String configuredPath = System.getenv(FFMPEG_PATH_ENV);
        if (configuredPath != null && !configuredPath.isBlank()) {
            Path ffmpegPath = Path.of(configuredPath);
            if (!Files.isRegularFile(ffmpegPath)) {
                throw new IllegalStateException(
                        "FFmpeg binary not found at " + ffmpegPath.toAbsolutePath()
                                + ". Set " + FFMPEG_PATH_ENV + " to a valid ffmpeg executable path.");
            }
            return;
        }

        try {
            Process process = new ProcessBuilder(DEFAULT_FFMPEG_BINARY, "-version")
                    .redirectErrorStream(true)
                    .start();
            boolean finished = process.waitFor(FFMPEG_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished || process.exitValue() != 0) {
                throw new IllegalStateException(
                        "FFmpeg is not available on PATH. Install FFmpeg or set " + FFMPEG_PATH_ENV + ".");
            }
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException(
                    "FFmpeg is not available on PATH. Install FFmpeg or set " + FFMPEG_PATH_ENV + ".",
                    e);
        }
    }

    private void checkProviderKey() {
        String apiKey = properties.atlas().apiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException(
                    "Atlas Cloud API key is missing. Set " + API_KEY_ENV + " or film-factory.atlas.api-key.");
        }
    }

    private void checkStorageRoot() {
        Path root = Path.of(properties.storage().root());
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new IllegalStateException("Artifact storage root cannot be created at " + root.toAbsolutePath() + ".", e);
        }
        if (!Files.isWritable(root)) {
            throw new IllegalStateException("Artifact storage root is not writable at " + root.toAbsolutePath() + ".");
        }
    }
}
