package github.sarthakdev143.film_factory.integration.provider;

import github.sarthakdev143.film_factory.model.JobType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

public class ProviderRegistry {

    private final Map<JobType, SyncGenerationProvider> syncProviders;
    private final Map<JobType, AsyncGenerationProvider> asyncProviders;

    public ProviderRegistry(
            Map<JobType, SyncGenerationProvider> syncProviders,
            Map<JobType, AsyncGenerationProvider> asyncProviders) {
        this.syncProviders = syncProviders.isEmpty() ? Map.of() : new EnumMap<>(syncProviders);
        this.asyncProviders = asyncProviders.isEmpty() ? Map.of() : new EnumMap<>(asyncProviders);
    }

    public SyncGenerationProvider syncFor(JobType jobType) {
        SyncGenerationProvider provider = syncProviders.get(jobType);
        if (provider == null) {
            throw new IllegalStateException("No synchronous provider registered for " + jobType.toApiValue());
        }
        return provider;
    }

    public AsyncGenerationProvider asyncFor(JobType jobType) {
        return findAsync(jobType).orElseThrow(() ->
                new IllegalStateException("No submit/poll provider registered for " + jobType.toApiValue()));
    }

    public Optional<AsyncGenerationProvider> findAsync(JobType jobType) {
        return Optional.ofNullable(asyncProviders.get(jobType));
    }
}
