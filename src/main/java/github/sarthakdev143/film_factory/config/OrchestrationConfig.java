package github.sarthakdev143.film_factory.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.film_factory.integration.media.FfmpegMediaAssembler;
import github.sarthakdev143.film_factory.integration.media.MediaAssembler;
import github.sarthakdev143.film_factory.integration.provider.ArtifactFetcher;
import github.sarthakdev143.film_factory.integration.provider.AtlasCloudClient;
import github.sarthakdev143.film_factory.integration.provider.AtlasImageProviderClient;
import github.sarthakdev143.film_factory.integration.provider.AtlasVideoProviderClient;
import github.sarthakdev143.film_factory.integration.provider.PollSchedule;
import github.sarthakdev143.film_factory.integration.provider.PredictionPoller;
import github.sarthakdev143.film_factory.integration.provider.ProviderRegistry;
import github.sarthakdev143.film_factory.integration.storage.LocalObjectStorage;
import github.sarthakdev143.film_factory.integration.storage.ObjectStorage;
import github.sarthakdev143.film_factory.model.JobType;
import github.sarthakdev143.film_factory.model.ResourceClass;
import github.sarthakdev143.film_factory.ratelimit.RateLimiter;
import github.sarthakdev143.film_factory.ratelimit.RateLimiterRegistry;
import github.sarthakdev143.film_factory.retry.RetryExecutor;
import github.sarthakdev143.film_factory.retry.RetryPolicy;
import github.sarthakdev143.film_factory.retry.Sleeper;
import github.sarthakdev143.film_factory.retry.TransientErrorClassifier;
import github.sarthakdev143.film_factory.service.ArtifactPersister;
import github.sarthakdev143.film_factory.service.CostCatalog;
import github.sarthakdev143.film_factory.service.GenerationDispatcher;
import github.sarthakdev143.film_factory.service.ShotPipelineOrchestrator;
import github.sarthakdev143.film_factory.service.ShotWorkFactory;
import github.sarthakdev143.film_factory.service.WorkRetryPolicies;
import github.sarthakdev143.film_factory.service.impl.DefaultGenerationDispatcher;
import github.sarthakdev143.film_factory.service.impl.DefaultShotPipelineOrchestrator;
import github.sarthakdev143.film_factory.service.impl.RestartResumer;
import github.sarthakdev143.film_factory.store.FilmJobRepository;
import github.sarthakdev143.film_factory.store.FilmJobStore;
import github.sarthakdev143.film_factory.store.GenerationJobRepository;
import github.sarthakdev143.film_factory.store.JobStore;
import github.sarthakdev143.film_factory.store.JpaFilmJobStore;
import github.sarthakdev143.film_factory.store.JpaJobStore;
import github.sarthakdev143.film_factory.store.StoreOperations;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(FilmFactoryProperties.class)
public class OrchestrationConfig {

    private static final Logger logger = LoggerFactory.getLogger(OrchestrationConfig.class);
    private static final Duration DOWNLOAD_TIMEOUT = Duration.ofMinutes(2);
    private static final Duration CLIP_WORK_GRACE = Duration.ofMinutes(5);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TaskExecutor generationTaskExecutor(FilmFactoryProperties properties) {
        FilmFactoryProperties.Executor settings = properties.executor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("generation-");
        executor.setCorePoolSize(settings.coreSize());
        executor.setMaxPoolSize(settings.maxSize());
        executor.setQueueCapacity(settings.queueCapacity());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService providerCallExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("provider-call-"));
    }

    @Bean
    public RetryExecutor providerRetryExecutor(ExecutorService providerCallExecutor) {
        return new RetryExecutor(providerCallExecutor, TransientErrorClassifier.defaults());
    }

    @Bean
    public StoreOperations storeOperations(
            PlatformTransactionManager transactionManager,
            ExecutorService providerCallExecutor,
            FilmFactoryProperties properties) {
        TransientErrorClassifier storeClassifier = TransientErrorClassifier.defaults().withTransientTypes(List.of(
                TransientDataAccessException.class,
                DataAccessResourceFailureException.class,
                CannotCreateTransactionException.class));
        return new StoreOperations(
                new TransactionTemplate(transactionManager),
                new RetryExecutor(providerCallExecutor, storeClassifier),
                properties.storeRetry().toPolicy());
    }

    @Bean
    public JobStore jobStore(GenerationJobRepository repository, StoreOperations storeOperations, Clock clock) {
        return new JpaJobStore(repository, storeOperations, clock);
    }

    @Bean
    public FilmJobStore filmJobStore(FilmJobRepository repository, StoreOperations storeOperations, Clock clock) {
        return new JpaFilmJobStore(repository, storeOperations, clock);
    }

    @Bean
    public RateLimiterRegistry rateLimiterRegistry(FilmFactoryProperties properties) {
        Map<ResourceClass, RateLimiter> limiters = new EnumMap<>(ResourceClass.class);
        for (ResourceClass resourceClass : ResourceClass.values()) {
            String key = resourceClass.name().toLowerCase(Locale.ROOT);
            FilmFactoryProperties.RateLimit limit = properties.rateLimits()
                    .getOrDefault(key, new FilmFactoryProperties.RateLimit(2, 0));
            limiters.put(resourceClass, new RateLimiter(key, limit.maxConcurrent(), limit.maxPerMinute()));
            logger.info("Rate limiter {} maxConcurrent={} maxPerMinute={}", key, limit.maxConcurrent(), limit.maxPerMinute());
        }
        return new RateLimiterRegistry(limiters);
    }

    @Bean
    public WorkRetryPolicies workRetryPolicies(FilmFactoryProperties properties) {
        // Clip work submits once and then polls; its own poll loop is deadline bounded.
        RetryPolicy clipPolicy = RetryPolicy.singleAttempt(properties.polling().maxDuration().plus(CLIP_WORK_GRACE));
        return new WorkRetryPolicies(properties.retry().toPolicy(), Map.of(JobType.CLIP, clipPolicy));
    }

    @Bean
    public GenerationDispatcher generationDispatcher(
            JobStore jobStore,
            RateLimiterRegistry rateLimiterRegistry,
            RetryExecutor providerRetryExecutor,
            WorkRetryPolicies workRetryPolicies,
            TaskExecutor generationTaskExecutor,
            MeterRegistry meterRegistry) {
        return new DefaultGenerationDispatcher(
                jobStore,
                rateLimiterRegistry,
                providerRetryExecutor,
                workRetryPolicies,
                generationTaskExecutor,
                meterRegistry);
    }

    @Bean
    public AtlasCloudClient atlasCloudClient(
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper,
            FilmFactoryProperties properties) {
        return new AtlasCloudClient(webClientBuilder, objectMapper, properties.atlas());
    }

    @Bean
    public ArtifactFetcher artifactFetcher(WebClient.Builder webClientBuilder) {
        return new ArtifactFetcher(webClientBuilder, DOWNLOAD_TIMEOUT);
    }

    @Bean
    public ProviderRegistry providerRegistry(
            AtlasCloudClient atlasCloudClient,
            ArtifactFetcher artifactFetcher,
            FilmFactoryProperties properties,
            Clock clock) {
        AtlasImageProviderClient images = new AtlasImageProviderClient(
                atlasCloudClient, artifactFetcher, properties.atlas(), Sleeper.SYSTEM, clock);
        AtlasVideoProviderClient videos = new AtlasVideoProviderClient(atlasCloudClient, properties.atlas());
        return new ProviderRegistry(Map.of(JobType.IMAGE, images), Map.of(JobType.CLIP, videos));
    }

    @Bean
    public PredictionPoller predictionPoller(RetryExecutor providerRetryExecutor, FilmFactoryProperties properties, Clock clock) {
        FilmFactoryProperties.Polling polling = properties.polling();
        return new PredictionPoller(
                providerRetryExecutor,
                properties.retry().toPolicy(),
                new PollSchedule(polling.interval(), polling.heartbeatEvery(), polling.maxDuration()),
                Sleeper.SYSTEM,
                clock);
    }

    @Bean
    public ObjectStorage objectStorage(FilmFactoryProperties properties) {
        return new LocalObjectStorage(Path.of(properties.storage().root()), properties.storage().publicBaseUrl());
    }

    @Bean
    public MediaAssembler mediaAssembler(ObjectStorage objectStorage, FilmFactoryProperties properties) {
        return FfmpegMediaAssembler.fromEnvironment(objectStorage, properties.assembly().timeout());
    }

    @Bean
    public ArtifactPersister artifactPersister(
            ArtifactFetcher artifactFetcher,
            ObjectStorage objectStorage,
            RetryExecutor providerRetryExecutor,
            FilmFactoryProperties properties) {
        RetryPolicy downloadPolicy = new RetryPolicy(
                properties.retry().maxAttempts(),
                properties.retry().baseDelay(),
                DOWNLOAD_TIMEOUT.plusSeconds(10),
                properties.retry().jitterRatio());
        return new ArtifactPersister(artifactFetcher, objectStorage, providerRetryExecutor, downloadPolicy);
    }

    @Bean
    public ShotWorkFactory shotWorkFactory(
            ProviderRegistry providerRegistry,
            PredictionPoller predictionPoller,
            ArtifactPersister artifactPersister) {
        return new ShotWorkFactory(providerRegistry, predictionPoller, artifactPersister);
    }

    @Bean
    public ShotPipelineOrchestrator shotPipelineOrchestrator(
            GenerationDispatcher generationDispatcher,
            FilmJobStore filmJobStore,
            ShotWorkFactory shotWorkFactory,
            MediaAssembler mediaAssembler,
            RetryExecutor providerRetryExecutor,
            FilmFactoryProperties properties,
            TaskExecutor generationTaskExecutor,
            MeterRegistry meterRegistry) {
        RetryPolicy assemblyPolicy = new RetryPolicy(2, Duration.ofSeconds(2), properties.assembly().timeout());
        return new DefaultShotPipelineOrchestrator(
                generationDispatcher,
                filmJobStore,
                shotWorkFactory,
                mediaAssembler,
                providerRetryExecutor,
                assemblyPolicy,
                new CostCatalog(properties.costs().imagePerUnit(), properties.costs().videoPerSecond()),
                generationTaskExecutor,
                meterRegistry);
    }

    @Bean
    public RestartResumer restartResumer(
            JobStore jobStore,
            FilmJobStore filmJobStore,
            ProviderRegistry providerRegistry,
            GenerationDispatcher generationDispatcher,
            ShotWorkFactory shotWorkFactory,
            ArtifactPersister artifactPersister,
            RetryExecutor providerRetryExecutor,
            FilmFactoryProperties properties,
            Clock clock) {
        return new RestartResumer(
                jobStore,
                filmJobStore,
                providerRegistry,
                generationDispatcher,
                shotWorkFactory,
                artifactPersister,
                providerRetryExecutor,
                properties.recovery(),
                clock);
    }
}
