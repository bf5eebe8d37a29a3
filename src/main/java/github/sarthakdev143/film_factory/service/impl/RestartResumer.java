package github.sarthakdev143.film_factory.service.impl;

import github.sarthakdev143.film_factory.config.FilmFactoryProperties;
import github.sarthakdev143.film_factory.integration.provider.AsyncGenerationProvider;
import github.sarthakdev143.film_factory.integration.provider.ProviderRegistry;
import github.sarthakdev143.film_factory.model.ErrorMessages;
import github.sarthakdev143.film_factory.model.ExternalPredictionRef;
import github.sarthakdev143.film_factory.model.GenerationJob;
import github.sarthakdev143.film_factory.model.JobStatus;
import github.sarthakdev143.film_factory.model.ProviderPrediction;
import github.sarthakdev143.film_factory.retry.RetryExecutor;
import github.sarthakdev143.film_factory.retry.RetryPolicy;
import github.sarthakdev143.film_factory.service.ArtifactPersister;
import github.sarthakdev143.film_factory.service.GenerationDispatcher;
import github.sarthakdev143.film_factory.service.RecoveryReport;
import github.sarthakdev143.film_factory.service.ShotWorkFactory;
import github.sarthakdev143.film_factory.store.FilmJobStore;
import github.sarthakdev143.film_factory.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Resolves jobs left in flight by a previous process. Every queued or generating job last touched
 * before this resumer was created belongs to that process, however recently it heartbeated. Jobs
 * with a recorded prediction are checked once with the provider and either finished or handed back
 * to the dispatcher for polling; all others are failed.
 *
 * <p>Provider checks are capped per startup. Jobs updated within {@code staleAfter} are checked
 * first, since their predictions are the likeliest to still be retrievable.
 */
public class RestartResumer {

    private static final Logger logger = LoggerFactory.getLogger(RestartResumer.class);
    static final String INTERRUPTED = "Interrupted by restart";
    static final String BACKLOG_EXCEEDED = INTERRUPTED + " (recovery backlog exceeded)";
    static final int STALE_BATCH_SIZE = 1000;

    private final JobStore jobStore;
    private final FilmJobStore filmJobStore;
    private final ProviderRegistry providers;
    private final GenerationDispatcher dispatcher;
    private final ShotWorkFactory shotWorkFactory;
    private final ArtifactPersister artifactPersister;
    private final RetryExecutor retryExecutor;
    private final FilmFactoryProperties.Recovery settings;
    private final Clock clock;
    private final int batchSize;
    private final Instant startedAt;

    public RestartResumer(
            JobStore jobStore,
            FilmJobStore filmJobStore,
            ProviderRegistry providers,
            GenerationDispatcher dispatcher,
            ShotWorkFactory shotWorkFactory,
            ArtifactPersister artifactPersister,
            RetryExecutor retryExecutor,
            FilmFactoryProperties.Recovery settings,
            Clock clock) {
        this(jobStore, filmJobStore, providers, dispatcher, shotWorkFactory, artifactPersister, retryExecutor,
                settings, clock, STALE_BATCH_SIZE);
    }

    RestartResumer(
            JobStore jobStore,
            FilmJobStore filmJobStore,
            ProviderRegistry providers,
            GenerationDispatcher dispatcher,
            ShotWorkFactory shotWorkFactory,
            ArtifactPersister artifactPersister,
            RetryExecutor retryExecutor,
            FilmFactoryProperties.Recovery settings,
            Clock clock,
            int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1.");
        }
        this.jobStore = jobStore;
        this.filmJobStore = filmJobStore;
        this.providers = providers;
        this.dispatcher = dispatcher;
        this.shotWorkFactory = shotWorkFactory;
        this.artifactPersister = artifactPersister;
        this.retryExecutor = retryExecutor;
        this.settings = settings;
        this.clock = clock;
        this.batchSize = batchSize;
        // Jobs this process creates from here on are never touched by recover().
        this.startedAt = clock.instant();
    }

    public RecoveryReport recover() {
        int filmsInterrupted = markFilmsInterrupted();
        Instant cutoff = clock.instant().minus(settings.staleAfter());
        Tally tally = new Tally();

        for (GenerationJob job : listRecent(JobStatus.GENERATING, cutoff)) {
            reconcileGenerating(job, tally);
        }
        forEachStale(JobStatus.GENERATING, cutoff, job -> reconcileGenerating(job, tally));

        for (GenerationJob job : listRecent(JobStatus.QUEUED, cutoff)) {
            fail(job, INTERRUPTED, tally);
        }
        forEachStale(JobStatus.QUEUED, cutoff, job -> fail(job, INTERRUPTED, tally));

        RecoveryReport report = new RecoveryReport(filmsInterrupted, tally.completed, tally.failed, tally.resumed);
        logger.info("Startup recovery finished filmsInterrupted={} completed={} failed={} resumed={} providerChecks={}",
                report.filmsInterrupted(), report.completed(), report.failed(), report.resumed(), tally.checks);
        return report;
    }

    private void reconcileGenerating(GenerationJob job, Tally tally) {
        try {
            Optional<ExternalPredictionRef> ref = job.predictionRef();
            Optional<AsyncGenerationProvider> provider = providers.findAsync(job.jobType());
            if (ref.isEmpty() || provider.isEmpty()) {
                fail(job, INTERRUPTED, tally);
                return;
            }
            if (tally.checks >= settings.maxProviderChecks()) {
                fail(job, BACKLOG_EXCEEDED, tally);
                return;
            }
            tally.checks++;
            recoverWithProvider(job, ref.get(), provider.get(), tally);
        } catch (RuntimeException e) {
            logger.error("Recovery of job {} failed", job.id(), e);
            fail(job, INTERRUPTED, tally);
        }
    }

    private void recoverWithProvider(
            GenerationJob job,
            ExternalPredictionRef ref,
            AsyncGenerationProvider provider,
            Tally tally) {
        ProviderPrediction prediction;
        try {
            prediction = retryExecutor.run(
                    "recovery check " + job.id(),
                    () -> provider.poll(ref.predictionId()),
                    RetryPolicy.singleAttempt(settings.statusCheckTimeout()));
        } catch (RuntimeException e) {
            fail(job, INTERRUPTED + " (could not check provider: " + ErrorMessages.describe(e) + ")", tally);
            return;
        }

        switch (prediction.state()) {
            case COMPLETED -> complete(job, prediction.outputUrl(), tally);
            case FAILED -> fail(job, prediction.error() == null ? "Generation failed" : prediction.error(), tally);
            case PENDING -> {
                dispatcher.resume(job, shotWorkFactory.resumePolling(job.jobType(), ref));
                tally.resumed++;
                logger.info("Resumed polling for job {} predictionId={}", job.id(), ref.predictionId());
            }
        }
    }

    private void complete(GenerationJob job, String outputUrl, Tally tally) {
        Map<String, Object> result;
        try {
            result = artifactPersister.persistFromUrl(ShotWorkFactory.prefixFor(job.jobType()), outputUrl);
        } catch (RuntimeException e) {
            fail(job, INTERRUPTED + " (could not persist output: " + ErrorMessages.describe(e) + ")", tally);
            return;
        }
        if (jobStore.update(job.id(), JobStatus.COMPLETED, result, null)) {
            tally.completed++;
            logger.info("Recovered completed job {} type={}", job.id(), job.jobType().toApiValue());
        }
    }

    private void fail(GenerationJob job, String message, Tally tally) {
        try {
            if (jobStore.update(job.id(), JobStatus.FAILED, job.result(), message)) {
                tally.failed++;
                logger.info("Failed stale job {} type={}: {}", job.id(), job.jobType().toApiValue(), message);
            }
        } catch (RuntimeException e) {
            logger.error("Could not fail stale job {}", job.id(), e);
        }
    }

    /**
     * Jobs updated between {@code cutoff} and this resumer's creation.
     */
    private List<GenerationJob> listRecent(JobStatus status, Instant cutoff) {
        try {
            return jobStore.listBy(status, null).stream()
                    .filter(job -> !job.updatedAt().isBefore(cutoff) && job.updatedAt().isBefore(startedAt))
                    .sorted(Comparator.comparing(GenerationJob::updatedAt).reversed())
                    .toList();
        } catch (RuntimeException e) {
            logger.error("Could not list recent {} jobs", status.toApiValue(), e);
            return List.of();
        }
    }

    /**
     * Pages through every job older than {@code cutoff}. Jobs that stay in {@code status} after
     * being handled (resumed, or a failed write) widen the next page so they cannot hide the rest.
     */
    private void forEachStale(JobStatus status, Instant cutoff, Consumer<GenerationJob> action) {
        Set<String> seen = new HashSet<>();
        while (true) {
            List<GenerationJob> page;
            try {
                page = jobStore.listStale(status, cutoff, batchSize + seen.size());
            } catch (RuntimeException e) {
                logger.error("Could not list stale {} jobs", status.toApiValue(), e);
                return;
            }

            List<GenerationJob> unseen = new ArrayList<>();
            for (GenerationJob job : page) {
                if (seen.add(job.id())) {
                    unseen.add(job);
                }
            }
            if (unseen.isEmpty()) {
                return;
            }
            unseen.forEach(action);
        }
    }

    private int markFilmsInterrupted() {
        try {
            return filmJobStore.markInterrupted(startedAt);
        } catch (RuntimeException e) {
            logger.error("Could not mark in-flight films interrupted", e);
            return 0;
        }
    }

    private static final class Tally {
        private int completed;
        private int failed;
        private int resumed;
        private int checks;
    }
}
