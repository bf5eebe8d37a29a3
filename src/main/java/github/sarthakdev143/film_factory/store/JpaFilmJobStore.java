package github.sarthakdev143.film_factory.store;

import github.sarthakdev143.film_factory.model.CompletedShot;
import github.sarthakdev143.film_factory.model.ErrorMessages;
import github.sarthakdev143.film_factory.model.FilmJobSnapshot;
import github.sarthakdev143.film_factory.model.FilmJobStatus;
import github.sarthakdev143.film_factory.model.ShotSpec;
import github.sarthakdev143.film_factory.store.entity.FilmJobEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

public class JpaFilmJobStore implements FilmJobStore {

    private static final Logger logger = LoggerFactory.getLogger(JpaFilmJobStore.class);

    private final FilmJobRepository repository;
    private final StoreOperations operations;
    private final Clock clock;

    public JpaFilmJobStore(FilmJobRepository repository, StoreOperations operations, Clock clock) {
        this.repository = repository;
        this.operations = operations;
        this.clock = clock;
    }

    @Override
    public FilmJobSnapshot create(String filmId, String ownerId, List<ShotSpec> shots) {
        return operations.inTransaction("createFilm", () -> {
            FilmJobEntity entity = new FilmJobEntity(filmId, ownerId, shots, clock.instant());
            return toSnapshot(repository.saveAndFlush(entity));
        });
    }

    @Override
    public Optional<FilmJobSnapshot> find(String filmId) {
        if (filmId == null || filmId.isBlank()) {
            return Optional.empty();
        }
        return operations.inTransaction("findFilm", () -> repository.findById(filmId).map(JpaFilmJobStore::toSnapshot));
    }

    @Override
    public List<ShotSpec> shots(String filmId) {
        return operations.inTransaction("filmShots", () -> repository.findById(filmId)
                .map(entity -> List.copyOf(entity.getShots()))
                .orElseThrow(() -> new IllegalArgumentException("Film not found: " + filmId)));
    }

    @Override
    public FilmJobSnapshot recordShotCompleted(String filmId, CompletedShot shot, double sceneRefCost, double videoCost) {
        return mutate("recordShotCompleted", filmId, entity -> {
            List<CompletedShot> completed = new ArrayList<>(entity.getCompletedShots());
            completed.removeIf(existing -> existing.number() == shot.number());
            completed.add(shot);
            completed.sort(Comparator.comparingInt(CompletedShot::number));
            entity.setCompletedShots(completed);

            List<Integer> failed = new ArrayList<>(entity.getFailedShots());
            failed.remove(Integer.valueOf(shot.number()));
            entity.setFailedShots(failed);

            entity.setCostSceneRefs(entity.getCostSceneRefs() + sceneRefCost);
            entity.setCostVideos(entity.getCostVideos() + videoCost);
        });
    }

    @Override
    public FilmJobSnapshot recordShotFailed(String filmId, int shotNumber, double sceneRefCost) {
        return mutate("recordShotFailed", filmId, entity -> {
            List<Integer> failed = new ArrayList<>(entity.getFailedShots());
            if (!failed.contains(shotNumber)) {
                failed.add(shotNumber);
                failed.sort(Comparator.naturalOrder());
            }
            entity.setFailedShots(failed);
            entity.setCostSceneRefs(entity.getCostSceneRefs() + sceneRefCost);
        });
    }

    @Override
    public FilmJobSnapshot transition(String filmId, FilmJobStatus status, String errorMessage) {
        return mutate("transitionFilm", filmId, entity -> {
            entity.setStatus(status);
            entity.setErrorMessage(ErrorMessages.truncate(errorMessage));
        });
    }

    @Override
    public FilmJobSnapshot markAssembled(String filmId, FilmJobStatus status, String artifactRef, double durationSeconds) {
        return mutate("markAssembled", filmId, entity -> {
            entity.setStatus(status);
            entity.setFinalArtifactRef(artifactRef);
            entity.setFinalDurationSeconds(durationSeconds);
            entity.setErrorMessage(null);
        });
    }

    @Override
    public int markInterrupted(Instant updatedBefore) {
        return operations.inTransaction("markFilmsInterrupted", () -> {
            List<FilmJobEntity> inFlight = repository.findByStatusIn(
                    List.of(FilmJobStatus.GENERATING, FilmJobStatus.ASSEMBLING)).stream()
                    .filter(entity -> entity.getUpdatedAt().isBefore(updatedBefore))
                    .toList();
            for (FilmJobEntity entity : inFlight) {
                logger.info("Marking film interrupted. filmId={}, previousStatus={}", entity.getFilmId(), entity.getStatus());
                entity.setStatus(FilmJobStatus.INTERRUPTED);
                entity.setErrorMessage("Interrupted by restart");
                touch(entity);
            }
            return inFlight.size();
        });
    }

    private FilmJobSnapshot mutate(String operation, String filmId, Consumer<FilmJobEntity> change) {
        return operations.inTransaction(operation, () -> {
            FilmJobEntity entity = repository.findForUpdate(filmId)
                    .orElseThrow(() -> new IllegalArgumentException("Film not found: " + filmId));
            change.accept(entity);
            touch(entity);
            return toSnapshot(entity);
        });
    }

    private void touch(FilmJobEntity entity) {
        Instant now = clock.instant();
        entity.setUpdatedAt(now.isBefore(entity.getUpdatedAt()) ? entity.getUpdatedAt() : now);
    }

    static FilmJobSnapshot toSnapshot(FilmJobEntity entity) {
        return new FilmJobSnapshot(
                entity.getFilmId(),
                entity.getOwnerId(),
                entity.getStatus(),
                entity.getTotalShots(),
                entity.getCompletedShots(),
                entity.getFailedShots(),
                entity.getFinalArtifactRef(),
                entity.getFinalDurationSeconds(),
                entity.getErrorMessage(),
                entity.getCostSceneRefs(),
                entity.getCostVideos(),
                entity.getCreatedAt(),
                entity.getUpdatedAt());
    }
}
