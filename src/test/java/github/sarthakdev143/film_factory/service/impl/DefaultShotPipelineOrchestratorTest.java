package github.sarthakdev143.film_factory.service.impl;

import github.sarthakdev143.film_factory.integration.media.MediaAssembler;
import github.sarthakdev143.film_factory.model.AssemblyResult;
import github.sarthakdev143.film_factory.model.CompletedShot;
import github.sarthakdev143.film_factory.model.FilmJobSnapshot;
import github.sarthakdev143.film_factory.model.FilmJobStatus;
import github.sarthakdev143.film_factory.model.ShotSpec;
import github.sarthakdev143.film_factory.ratelimit.RateLimiterRegistry;
import github.sarthakdev143.film_factory.retry.ErrorKind;
import github.sarthakdev143.film_factory.retry.ProviderCallException;
import github.sarthakdev143.film_factory.retry.RetryExecutor;
import github.sarthakdev143.film_factory.retry.RetryPolicy;
import github.sarthakdev143.film_factory.retry.TransientErrorClassifier;
import github.sarthakdev143.film_factory.service.ArtifactPersister;
import github.sarthakdev143.film_factory.service.CostCatalog;
import github.sarthakdev143.film_factory.service.FilmNotFoundException;
import github.sarthakdev143.film_factory.service.GenerationWork;
import github.sarthakdev143.film_factory.service.ShotWorkFactory;
import github.sarthakdev143.film_factory.service.WorkRetryPolicies;
import github.sarthakdev143.film_factory.support.InMemoryFilmJobStore;
import github.sarthakdev143.film_factory.support.InMemoryJobStore;
import github.sarthakdev143.film_factory.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultShotPipelineOrchestratorTest {

    @Mock
    private MediaAssembler mediaAssembler;

    private InMemoryJobStore jobStore;
    private InMemoryFilmJobStore filmJobStore;
    private ScriptedShotWorkFactory shotWorkFactory;
    private ExecutorService callExecutor;
    private SimpleMeterRegistry meterRegistry;
    private DefaultShotPipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        jobStore = new InMemoryJobStore(clock);
        filmJobStore = new InMemoryFilmJobStore(clock);
        shotWorkFactory = new ScriptedShotWorkFactory();
        callExecutor = Executors.newCachedThreadPool();
        meterRegistry = new SimpleMeterRegistry();
        TaskExecutor directExecutor = Runnable::run;
        RetryExecutor retryExecutor = new RetryExecutor(callExecutor, TransientErrorClassifier.defaults(), duration -> {
        }, () -> 0.0);

        DefaultGenerationDispatcher dispatcher = new DefaultGenerationDispatcher(
                jobStore,
                new RateLimiterRegistry(Map.of()),
                retryExecutor,
                WorkRetryPolicies.uniform(new RetryPolicy(1, Duration.ZERO, null, 0)),
                directExecutor,
                meterRegistry);
        orchestrator = new DefaultShotPipelineOrchestrator(
                dispatcher,
                filmJobStore,
                shotWorkFactory,
                mediaAssembler,
                retryExecutor,
                new RetryPolicy(2, Duration.ZERO, null, 0),
                new CostCatalog(0.04, 0.022),
                directExecutor,
                meterRegistry);
    }

    @AfterEach
    void tearDown() {
        callExecutor.shutdownNow();
    }

    @Test
    void startFilmAssemblesAllShotsInOrder() throws Exception {
        when(mediaAssembler.assemble(anyString(), anyList())).thenReturn(new AssemblyResult("/artifacts/films/f.mp4", 24.0));

        String filmId = orchestrator.startFilm("owner-1", shots(3));

        FilmJobSnapshot film = filmJobStore.find(filmId).orElseThrow();
        assertThat(film.status()).isEqualTo(FilmJobStatus.READY);
        assertThat(film.finalArtifactRef()).isEqualTo("/artifacts/films/f.mp4");
        assertThat(film.finalDurationSeconds()).isEqualTo(24.0);
        assertThat(film.costSceneRefs()).isEqualTo(0.12, offset(1e-9));
        assertThat(film.costVideos()).isEqualTo(0.528, offset(1e-9));
        assertThat(filmJobStore.transitions()).containsExactly(FilmJobStatus.ASSEMBLING, FilmJobStatus.READY);
        verify(mediaAssembler).assemble(filmId, List.of(
                "/artifacts/clips/1-1.mp4", "/artifacts/clips/2-1.mp4", "/artifacts/clips/3-1.mp4"));
    }

    @Test
    void startFilmUsesKeyframeSourceUrlAsFirstFrame() throws Exception {
        when(mediaAssembler.assemble(anyString(), anyList())).thenReturn(new AssemblyResult("/artifacts/films/f.mp4", 8.0));

        orchestrator.startFilm("owner-1", shots(1));

        assertThat(shotWorkFactory.keyframes).hasValue(1);
        assertThat(shotWorkFactory.firstFrames).containsEntry(1, "https://cdn.example/keyframe-1.png");
    }

    @Test
    void keyframeWithoutPublicUrlFailsShotWithoutSubmittingClip() throws Exception {
        when(mediaAssembler.assemble(anyString(), anyList())).thenReturn(new AssemblyResult("/artifacts/films/f.mp4", 8.0));
        shotWorkFactory.inlineKeyframes.add(2);

        String filmId = orchestrator.startFilm("owner-1", shots(2));

        FilmJobSnapshot film = filmJobStore.find(filmId).orElseThrow();
        assertThat(film.status()).isEqualTo(FilmJobStatus.PARTIAL);
        assertThat(film.failedShots()).containsExactly(2);
        assertThat(film.costSceneRefs()).isEqualTo(0.08, offset(1e-9));
        assertThat(shotWorkFactory.clipRuns).containsOnlyKeys(1);
        assertThat(shotWorkFactory.firstFrames.values()).noneMatch(url -> url.startsWith("/artifacts/"));
    }

    @Test
    void keyframeWithoutPublicUrlIsReportedWhenEveryShotFails() {
        shotWorkFactory.inlineKeyframes.add(1);

        String filmId = orchestrator.startFilm("owner-1", shots(1));

        FilmJobSnapshot film = filmJobStore.find(filmId).orElseThrow();
        assertThat(film.status()).isEqualTo(FilmJobStatus.FAILED);
        assertThat(film.errorMessage()).contains("no public image URL");
        verifyNoInteractions(mediaAssembler);
    }

    @Test
    void startFilmSkipsKeyframeWhenReferenceImageGiven() throws Exception {
        when(mediaAssembler.assemble(anyString(), anyList())).thenReturn(new AssemblyResult("/artifacts/films/f.mp4", 8.0));

        String filmId = orchestrator.startFilm("owner-1",
                List.of(new ShotSpec(1, "a red kite over dunes", "https://images.example/kite.png", 8)));

        assertThat(shotWorkFactory.keyframes).hasValue(0);
        assertThat(shotWorkFactory.firstFrames).containsEntry(1, "https://images.example/kite.png");
        assertThat(filmJobStore.find(filmId).orElseThrow().costSceneRefs()).isZero();
    }

    @Test
    void startFilmAssemblesPartialFilmWhenOneShotFails() throws Exception {
        shotWorkFactory.failingClips.add(2);
        when(mediaAssembler.assemble(anyString(), anyList())).thenReturn(new AssemblyResult("/artifacts/films/p.mp4", 16.0));

        String filmId = orchestrator.startFilm("owner-1", shots(3));

        FilmJobSnapshot film = filmJobStore.find(filmId).orElseThrow();
        assertThat(film.status()).isEqualTo(FilmJobStatus.PARTIAL);
        assertThat(film.failedShots()).containsExactly(2);
        assertThat(film.completedShots()).extracting(CompletedShot::number).containsExactly(1, 3);
        assertThat(film.costSceneRefs()).isEqualTo(0.12, offset(1e-9));
        assertThat(film.costVideos()).isEqualTo(0.352, offset(1e-9));
        assertThat(meterRegistry.counter("film_factory.shots.failed").count()).isEqualTo(1.0);

        ArgumentCaptor<List<String>> refs = ArgumentCaptor.forClass(List.class);
        verify(mediaAssembler).assemble(eq(filmId), refs.capture());
        assertThat(refs.getValue()).containsExactly("/artifacts/clips/1-1.mp4", "/artifacts/clips/3-1.mp4");
    }

    @Test
    void startFilmFailsWhenEveryShotFails() {
        shotWorkFactory.failingClips.addAll(Set.of(1, 2));

        String filmId = orchestrator.startFilm("owner-1", shots(2));

        FilmJobSnapshot film = filmJobStore.find(filmId).orElseThrow();
        assertThat(film.status()).isEqualTo(FilmJobStatus.FAILED);
        assertThat(film.errorMessage())
                .startsWith("All shots failed: shot 1 (clip failed: Generation failed: shot 1 rejected)")
                .contains("shot 2 (clip failed: Generation failed: shot 2 rejected)");
        verifyNoInteractions(mediaAssembler);
    }

    @Test
    void startFilmFailsWhenAssemblyFails() throws Exception {
        when(mediaAssembler.assemble(anyString(), anyList())).thenThrow(new IOException("ffmpeg exited with code 1"));

        String filmId = orchestrator.startFilm("owner-1", shots(2));

        FilmJobSnapshot film = filmJobStore.find(filmId).orElseThrow();
        assertThat(film.status()).isEqualTo(FilmJobStatus.FAILED);
        assertThat(film.errorMessage()).isEqualTo("Assembly failed: ffmpeg exited with code 1");
        assertThat(film.completedShots()).hasSize(2);
    }

    @Test
    void startFilmRejectsInvalidShotLists() {
        assertThatThrownBy(() -> orchestrator.startFilm("owner-1", List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> orchestrator.startFilm("owner-1",
                List.of(new ShotSpec(1, "a", null, 8), new ShotSpec(3, "b", null, 8))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("without gaps");
        assertThatThrownBy(() -> orchestrator.startFilm("owner-1", List.of(new ShotSpec(1, " ", null, 8))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("needs a prompt");
        assertThatThrownBy(() -> orchestrator.startFilm(" ", shots(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(jobStore.all()).isEmpty();
    }

    @Test
    void regenerateShotAppendsFeedbackAndReassembles() throws Exception {
        shotWorkFactory.failingClips.add(2);
        when(mediaAssembler.assemble(anyString(), anyList())).thenReturn(new AssemblyResult("/artifacts/films/f.mp4", 16.0));
        String filmId = orchestrator.startFilm("owner-1", shots(2));
        shotWorkFactory.failingClips.clear();

        orchestrator.regenerateShot(filmId, 2, "make the sky darker");

        FilmJobSnapshot film = filmJobStore.find(filmId).orElseThrow();
        assertThat(film.status()).isEqualTo(FilmJobStatus.READY);
        assertThat(film.failedShots()).isEmpty();
        assertThat(shotWorkFactory.clipPrompts.get(2)).isEqualTo("prompt 2\n\nADJUSTMENT: make the sky darker");
        verify(mediaAssembler, times(2)).assemble(eq(filmId), anyList());
        verify(mediaAssembler).assemble(filmId, List.of("/artifacts/clips/1-1.mp4", "/artifacts/clips/2-2.mp4"));
    }

    @Test
    void regenerateShotRejectsFilmStillInFlight() {
        filmJobStore.create("film-busy", "owner-1", shots(1));

        assertThatThrownBy(() -> orchestrator.regenerateShot("film-busy", 1, null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void regenerateShotRejectsUnknownFilmOrShot() throws Exception {
        when(mediaAssembler.assemble(anyString(), anyList())).thenReturn(new AssemblyResult("/artifacts/films/f.mp4", 8.0));
        String filmId = orchestrator.startFilm("owner-1", shots(1));

        assertThatThrownBy(() -> orchestrator.regenerateShot("ghost", 1, null))
                .isInstanceOf(FilmNotFoundException.class);
        assertThatThrownBy(() -> orchestrator.regenerateShot(filmId, 5, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("has no shot 5");
    }

    private static List<ShotSpec> shots(int count) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(number -> new ShotSpec(number, "prompt " + number, null, 8))
                .toList();
    }

    private static final class ScriptedShotWorkFactory extends ShotWorkFactory {

        private final Set<Integer> failingClips = ConcurrentHashMap.newKeySet();
        private final Map<Integer, String> clipPrompts = new ConcurrentHashMap<>();
        private final Map<Integer, String> firstFrames = new ConcurrentHashMap<>();
        private final Map<Integer, AtomicInteger> clipRuns = new ConcurrentHashMap<>();
        private final Set<Integer> inlineKeyframes = ConcurrentHashMap.newKeySet();
        private final AtomicInteger keyframes = new AtomicInteger();

        private ScriptedShotWorkFactory() {
            super(null, null, null);
        }

        @Override
        public GenerationWork keyframe(ShotSpec shot) {
            return context -> {
                keyframes.incrementAndGet();
                if (inlineKeyframes.contains(shot.number())) {
                    return Map.of(ArtifactPersister.ARTIFACT_REF, "/artifacts/keyframes/" + shot.number() + ".png");
                }
                return Map.of(
                        ArtifactPersister.ARTIFACT_REF, "/artifacts/keyframes/" + shot.number() + ".png",
                        ArtifactPersister.SOURCE_URL, "https://cdn.example/keyframe-" + shot.number() + ".png");
            };
        }

        @Override
        public GenerationWork clip(ShotSpec shot, String firstFrameUrl) {
            return context -> {
                int run = clipRuns.computeIfAbsent(shot.number(), ignored -> new AtomicInteger()).incrementAndGet();
                clipPrompts.put(shot.number(), shot.prompt());
                firstFrames.put(shot.number(), firstFrameUrl);
                if (failingClips.contains(shot.number())) {
                    throw new ProviderCallException(
                            "Generation failed: shot " + shot.number() + " rejected", ErrorKind.PERMANENT);
                }
                return Map.of(ArtifactPersister.ARTIFACT_REF, "/artifacts/clips/" + shot.number() + "-" + run + ".mp4");
            };
        }
    }
}
