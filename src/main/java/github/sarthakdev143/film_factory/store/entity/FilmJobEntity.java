package github.sarthakdev143.film_factory.store.entity;

import github.sarthakdev143.film_factory.model.CompletedShot;
import github.sarthakdev143.film_factory.model.FilmJobStatus;
import github.sarthakdev143.film_factory.model.ShotSpec;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "film_jobs")
public class FilmJobEntity {

    @Id
    @Column(name = "film_id", length = 36, nullable = false, updatable = false)
    private String filmId;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private FilmJobStatus status;

    @Column(name = "total_shots", nullable = false)
    private int totalShots;

    @Convert(converter = ShotSpecListConverter.class)
    @Column(name = "shots_json", length = 64000)
    private List<ShotSpec> shots = new ArrayList<>();

    @Convert(converter = CompletedShotListConverter.class)
    @Column(name = "completed_shots_json", length = 16000)
    private List<CompletedShot> completedShots = new ArrayList<>();

    @Convert(converter = IntegerListConverter.class)
    @Column(name = "failed_shots_json", length = 2000)
    private List<Integer> failedShots = new ArrayList<>();

    @Column(name = "final_artifact_ref", length = 1000)
    private String finalArtifactRef;

    @Column(name = "final_duration_seconds")
    private Double finalDurationSeconds;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "cost_scene_refs", nullable = false)
    private double costSceneRefs;

    @Column(name = "cost_videos", nullable = false)
    private double costVideos;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected FilmJobEntity() {
    }

    public FilmJobEntity(String filmId, String ownerId, List<ShotSpec> shots, Instant createdAt) {
        this.filmId = filmId;
        this.ownerId = ownerId;
        this.status = FilmJobStatus.GENERATING;
        this.shots = new ArrayList<>(shots);
        this.totalShots = shots.size();
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public String getFilmId() {
        return filmId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public FilmJobStatus getStatus() {
        return status;
    }

    public void setStatus(FilmJobStatus status) {
        this.status = status;
    }

    public int getTotalShots() {
        return totalShots;
    }

    public List<ShotSpec> getShots() {
        return shots == null ? List.of() : shots;
    }

    public List<CompletedShot> getCompletedShots() {
        return completedShots == null ? List.of() : completedShots;
    }

    public void setCompletedShots(List<CompletedShot> completedShots) {
        this.completedShots = completedShots;
    }

    public List<Integer> getFailedShots() {
        return failedShots == null ? List.of() : failedShots;
    }

    public void setFailedShots(List<Integer> failedShots) {
        this.failedShots = failedShots;
    }

    public String getFinalArtifactRef() {
        return finalArtifactRef;
    }

    public void setFinalArtifactRef(String finalArtifactRef) {
        this.finalArtifactRef = finalArtifactRef;
    }

    public Double getFinalDurationSeconds() {
        return finalDurationSeconds;
    }

    public void setFinalDurationSeconds(Double finalDurationSeconds) {
        this.finalDurationSeconds = finalDurationSeconds;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public double getCostSceneRefs() {
        return costSceneRefs;
    }

    public void setCostSceneRefs(double costSceneRefs) {
        this.costSceneRefs = costSceneRefs;
    }

    public double getCostVideos() {
        return costVideos;
    }

    public void setCostVideos(double costVideos) {
        this.costVideos = costVideos;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
