package github.sarthakdev143.film_factory.service.impl;

import github.sarthakdev143.film_factory.integration.media.MediaAssembler;
import github.sarthakdev143.film_factory.model.AssemblyResult;
import github.sarthakdev143.film_factory.model.CompletedShot;
import github.sarthakdev143.film_factory.model.ErrorMessages;
import github.sarthakdev143.film_factory.model.FilmJobSnapshot;
import github.sarthakdev143.film_factory.model.FilmJobStatus;
import github.sarthakdev143.film_factory.model.GenerationJob;
import github.sarthakdev143.film_factory.model.JobStatus;
import github.sarthakdev143.film_factory.model.JobType;
import github.sarthakdev143.film_factory.model.ShotSpec;
import github.sarthakdev143.film_factory.retry.RetryExecutor;
import github.sarthakdev143.film_factory.retry.RetryPolicy;
import github.sarthakdev143.film_factory.service.ArtifactPersister;
import github.sarthakdev143.film_factory.service.CostCatalog;
import github.sarthakdev143.film_factory.service.DispatchedJob;
import github.sarthakdev143.film_factory.service.FilmNotFoundException;
import github.sarthakdev143.film_factory.service.GenerationWork;
import github.sarthakdev143.film_factory.service.GenerationDispatcher;
import github.sarthakdev143.film_factory.service.ShotPipelineOrchestrator;
import github.sarthakdev143.film_factory.service.ShotWorkFactory;
import github.sarthakdev143.film_factory.store.FilmJobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

public class DefaultShotPipelineOrchestrator implements ShotPipelineOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(DefaultShotPipelineOrchestrator.class);
    private static final Set<FilmJobStatus> REGENERATABLE = EnumSet.of(
            FilmJobStatus.READY,
            FilmJobStatus.PARTIAL,
            FilmJobStatus.FAILED,
            FilmJobStatus.INTERRUPTED);

    private final GenerationDispatcher dispatcher;
    private final FilmJobStore filmJobStore;
    private final ShotWorkFactory shotWorkFactory;
    private final MediaAssembler mediaAssembler;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy assemblyPolicy;
    private final CostCatalog costs;
    private final TaskExecutor taskExecutor;
    private final Set<String> activeFilms = ConcurrentHashMap.newKeySet();
    private final Counter filmsStartedCounter;
    private final Counter shotFailureCounter;

    public DefaultShotPipelineOrchestrator(
            GenerationDispatcher dispatcher,
            FilmJobStore filmJobStore,
            ShotWorkFactory shotWorkFactory,
            MediaAssembler mediaAssembler,
            RetryExecutor retryExecutor,
            RetryPolicy assemblyPolicy,
            CostCatalog costs,
            TaskExecutor taskExecutor,
            MeterRegistry meterRegistry) {
        this.dispatcher = dispatcher;
        this.filmJobStore = filmJobStore;
        this.shotWorkFactory = shotWorkFactory;
        this.mediaAssembler = mediaAssembler;
        this.retryExecutor = retryExecutor;
        this.assemblyPolicy = assemblyPolicy;
        this.costs = costs;
        this.taskExecutor = taskExecutor;
        this.filmsStartedCounter = meterRegistry.counter("film_factory.films.started");
        this.shotFailureCounter = meterRegistry.counter("film_factory.shots.failed");
    }

    @Override
    public String startFilm(String ownerId, List<ShotSpec> shots) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId is required.");
        }
        List<ShotSpec> ordered = validateShots(shots);

        String filmId = UUID.randomUUID().toString();
        filmJobStore.create(filmId, ownerId, ordered);
        activeFilms.add(filmId);
        filmsStartedCounter.increment();
        logger.info("Accepted film {} ownerId={} shots={}", filmId, ownerId, ordered.size());

        Map<Integer, String> errors = new ConcurrentSkipListMap<>();
        List<CompletableFuture<Void>> shotRuns = new ArrayList<>();
        for (ShotSpec shot : ordered) {
            shotRuns.add(runShot(filmId, ownerId, shot, errors));
        }
        finishWhenDone(filmId, shotRuns, errors);
        return filmId;
    }

    @Override
    public void regenerateShot(String filmId, int shotNumber, String feedback) {
        FilmJobSnapshot film = filmJobStore.find(filmId)
                .orElseThrow(() -> new FilmNotFoundException(filmId));
        if (!REGENERATABLE.contains(film.status())) {
            throw new IllegalStateException("Film " + filmId + " is " + film.status().toApiValue()
                    + "; shots can be regenerated once it is ready, partial, failed or interrupted.");
        }

        ShotSpec original = filmJobStore.shots(filmId).stream()
                .filter(shot -> shot.number() == shotNumber)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Film " + filmId + " has no shot " + shotNumber + "."));

        if (!activeFilms.add(filmId)) {
            throw new IllegalStateException("Film " + filmId + " is already being regenerated.");
        }
        ShotSpec shot = withFeedback(original, feedback);
        try {
            filmJobStore.transition(filmId, FilmJobStatus.GENERATING, null);
        } catch (RuntimeException e) {
            activeFilms.remove(filmId);
            throw e;
        }
        logger.info("Regenerating film {} shot={} withFeedback={}", filmId, shotNumber, feedback != null && !feedback.isBlank());

        Map<Integer, String> errors = new ConcurrentSkipListMap<>();
        finishWhenDone(filmId, List.of(runShot(filmId, film.ownerId(), shot, errors)), errors);
    }

    @Override
    public Optional<FilmJobSnapshot> find(String filmId) {
        return filmJobStore.find(filmId);
    }

    private CompletableFuture<Void> runShot(String filmId, String ownerId, ShotSpec shot, Map<Integer, String> errors) {
        String clipTarget = filmId + ":shot-" + shot.number();

        CompletableFuture<String> firstFrame = shot.needsKeyframe()
                ? dispatchAndAwait(ownerId, JobType.IMAGE, clipTarget + ":keyframe", shotWorkFactory.keyframe(shot), false)
                        .thenApply(DefaultShotPipelineOrchestrator::firstFrameUrl)
                : CompletableFuture.completedFuture(shot.referenceImageUrl());

        return firstFrame
                .thenCompose(imageUrl -> dispatchAndAwait(
                        ownerId, JobType.CLIP, clipTarget, shotWorkFactory.clip(shot, imageUrl), shot.needsKeyframe()))
                .handle((clipJob, error) -> {
                    recordOutcome(filmId, shot, clipJob, error, errors);
                    return null;
                });
    }

    private CompletableFuture<GenerationJob> dispatchAndAwait(
            String ownerId,
            JobType jobType,
            String targetId,
            GenerationWork work,
            boolean keyframeGenerated) {
        String stage = jobType == JobType.IMAGE ? "keyframe" : "clip";
        DispatchedJob dispatched;
        try {
            dispatched = dispatcher.submit(ownerId, jobType, targetId, work);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(
                    new ShotFailedException(stage + " could not be dispatched: " + ErrorMessages.describe(e), keyframeGenerated));
        }
        return dispatcher.completion(dispatched.jobId()).thenApply(job -> {
            if (job.status() != JobStatus.COMPLETED) {
                throw new ShotFailedException(stage + " failed: " + job.errorMessage(), keyframeGenerated);
            }
            return job;
        });
    }

    private void recordOutcome(
            String filmId,
            ShotSpec shot,
            GenerationJob clipJob,
            Throwable error,
            Map<Integer, String> errors) {
        double keyframeCost = shot.needsKeyframe() ? costs.imageCost() : 0.0;
        try {
            if (error == null) {
                String artifactRef = String.valueOf(clipJob.result().get(ArtifactPersister.ARTIFACT_REF));
                filmJobStore.recordShotCompleted(
                        filmId,
                        new CompletedShot(shot.number(), artifactRef),
                        keyframeCost,
                        costs.videoCost(shot.durationSeconds()));
                logger.info("Film {} shot {} completed", filmId, shot.number());
                return;
            }

            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            boolean keyframeBilled = cause instanceof ShotFailedException shotFailure && shotFailure.keyframeGenerated();
            shotFailureCounter.increment();
            errors.put(shot.number(), ErrorMessages.describe(cause));
            filmJobStore.recordShotFailed(filmId, shot.number(), keyframeBilled ? keyframeCost : 0.0);
            logger.warn("Film {} shot {} failed: {}", filmId, shot.number(), cause.getMessage());
        } catch (RuntimeException storeError) {
            errors.putIfAbsent(shot.number(), ErrorMessages.describe(storeError));
            logger.error("Could not record outcome of film {} shot {}", filmId, shot.number(), storeError);
        }
    }

    private void finishWhenDone(String filmId, List<CompletableFuture<Void>> shotRuns, Map<Integer, String> errors) {
        CompletableFuture.allOf(shotRuns.toArray(CompletableFuture[]::new))
                .whenCompleteAsync((ignored, error) -> {
                    try {
                        finalizeFilm(filmId, errors);
                    } finally {
                        activeFilms.remove(filmId);
                    }
                }, taskExecutor);
    }

    private void finalizeFilm(String filmId, Map<Integer, String> errors) {
        try {
            FilmJobSnapshot film = filmJobStore.find(filmId)
                    .orElseThrow(() -> new FilmNotFoundException(filmId));

            if (film.completedShots().isEmpty()) {
                String message = "All shots failed: " + errors.entrySet().stream()
                        .map(entry -> "shot " + entry.getKey() + " (" + entry.getValue() + ")")
                        .collect(Collectors.joining(", "));
                filmJobStore.transition(filmId, FilmJobStatus.FAILED, message);
                logger.warn("Film {} failed, no shot completed", filmId);
                return;
            }

            filmJobStore.transition(filmId, FilmJobStatus.ASSEMBLING, null);
            List<CompletedShot> ordered = film.completedShots().stream()
                    .sorted(Comparator.comparingInt(CompletedShot::number))
                    .toList();
            List<String> refs = ordered.stream().map(CompletedShot::artifactRef).toList();

            AssemblyResult assembled = retryExecutor.run(
                    "assemble film " + filmId,
                    () -> mediaAssembler.assemble(filmId, refs),
                    assemblyPolicy);

            FilmJobStatus status = isComplete(film, ordered) ? FilmJobStatus.READY : FilmJobStatus.PARTIAL;
            filmJobStore.markAssembled(filmId, status, assembled.artifactRef(), assembled.durationSeconds());
            logger.info("Film {} {} shots={}/{} durationSeconds={}",
                    filmId, status.toApiValue(), ordered.size(), film.totalShots(), assembled.durationSeconds());
        } catch (RuntimeException e) {
            logger.error("Film {} could not be finalized", filmId, e);
            try {
                filmJobStore.transition(filmId, FilmJobStatus.FAILED, "Assembly failed: " + ErrorMessages.describe(e));
            } catch (RuntimeException storeError) {
                logger.error("Could not mark film {} failed", filmId, storeError);
            }
        }
    }

    private static boolean isComplete(FilmJobSnapshot film, List<CompletedShot> ordered) {
        Set<Integer> numbers = new HashSet<>();
        for (CompletedShot shot : ordered) {
            numbers.add(shot.number());
        }
        return film.failedShots().isEmpty() && numbers.size() == film.totalShots();
    }

    /**
     * The video provider fetches the first frame itself, so only the provider-published URL works;
     * our own artifact refs are not reachable from outside.
     */
    private static String firstFrameUrl(GenerationJob keyframeJob) {
        Object source = keyframeJob.result().get(ArtifactPersister.SOURCE_URL);
        if (source == null || source.toString().isBlank()) {
            throw new ShotFailedException("keyframe failed: no public image URL for the video provider", true);
        }
        return source.toString();
    }

    private static ShotSpec withFeedback(ShotSpec shot, String feedback) {
        if (feedback == null || feedback.isBlank()) {
            return shot;
        }
        String prompt = (shot.prompt() == null ? "" : shot.prompt()) + "\n\nADJUSTMENT: " + feedback.trim();
        return new ShotSpec(shot.number(), prompt, shot.referenceImageUrl(), shot.durationSeconds());
    }

    private static List<ShotSpec> validateShots(List<ShotSpec> shots) {
        if (shots == null || shots.isEmpty()) {
            throw new IllegalArgumentException("At least one shot is required.");
        }
        List<ShotSpec> ordered = shots.stream()
                .sorted(Comparator.comparingInt(ShotSpec::number))
                .toList();
        for (int index = 0; index < ordered.size(); index++) {
            ShotSpec shot = ordered.get(index);
            if (shot.number() != index + 1) {
                throw new IllegalArgumentException("Shots must be numbered 1.." + ordered.size() + " without gaps.");
            }
            if (shot.prompt() == null || shot.prompt().isBlank()) {
                throw new IllegalArgumentException("Shot " + shot.number() + " needs a prompt.");
            }
        }
        return ordered;
    }
}
