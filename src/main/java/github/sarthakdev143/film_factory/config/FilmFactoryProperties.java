package github.sarthakdev143.film_factory.config;

import github.sarthakdev143.film_factory.retry.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.Map;

@ConfigurationProperties(prefix = "film-factory")
public record FilmFactoryProperties(
        Map<String, RateLimit> rateLimits,
        @DefaultValue Retry retry,
        @DefaultValue StoreRetry storeRetry,
        @DefaultValue Polling polling,
        @DefaultValue Recovery recovery,
        @DefaultValue Executor executor,
        @DefaultValue Atlas atlas,
        @DefaultValue Storage storage,
        @DefaultValue Costs costs,
        @DefaultValue Assembly assembly) {

    public FilmFactoryProperties {
        rateLimits = rateLimits == null ? Map.of() : Map.copyOf(rateLimits);
    }

    public record RateLimit(
            @DefaultValue("2") int maxConcurrent,
            @DefaultValue("0") int maxPerMinute) {
    }

    public record Retry(
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("2s") Duration baseDelay,
            @DefaultValue("60s") Duration perCallTimeout,
            @DefaultValue("0.3") double jitterRatio) {

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, baseDelay, perCallTimeout, jitterRatio);
        }
    }

    public record StoreRetry(
            @DefaultValue("4") int maxAttempts,
            @DefaultValue("1s") Duration baseDelay,
            @DefaultValue("0.3") double jitterRatio) {

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, baseDelay, null, jitterRatio);
        }
    }

    public record Polling(
            @DefaultValue("3s") Duration interval,
            @DefaultValue("30s") Duration heartbeatEvery,
            @DefaultValue("10m") Duration maxDuration) {
    }

    public record Recovery(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("5m") Duration staleAfter,
            @DefaultValue("10") int maxProviderChecks,
            @DefaultValue("5s") Duration statusCheckTimeout) {
    }

    public record Executor(
            @DefaultValue("8") int coreSize,
            @DefaultValue("32") int maxSize,
            @DefaultValue("500") int queueCapacity) {
    }

    public record Atlas(
            @DefaultValue("https://api.atlascloud.ai/api/v1") String baseUrl,
            String apiKey,
            @DefaultValue("bytedance/seedance-v1.5-pro/image-to-video-fast") String videoModel,
            @DefaultValue("google/nano-banana-pro/text-to-image-ultra") String imageModel,
            @DefaultValue("9:16") String aspectRatio,
            @DefaultValue("720p") String resolution,
            @DefaultValue("30s") Duration requestTimeout) {
    }

    public record Storage(
            @DefaultValue("./data/artifacts") String root,
            @DefaultValue("/artifacts") String publicBaseUrl) {
    }

    public record Costs(
            @DefaultValue("0.04") double imagePerUnit,
            @DefaultValue("0.022") double videoPerSecond) {
    }

    public record Assembly(
            @DefaultValue("10m") Duration timeout) {
    }
}
