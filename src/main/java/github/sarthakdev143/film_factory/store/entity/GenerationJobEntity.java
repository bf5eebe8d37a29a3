package github.sarthakdev143.film_factory.store.entity;

import github.sarthakdev143.film_factory.model.JobStatus;
import github.sarthakdev143.film_factory.model.JobType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;
import java.util.Map;

/**
 * Row of the persisted job table. {@code activeKey} carries the dedup triple while the job is
 * queued or generating and is cleared on the terminal write, so the unique constraint only
 * applies to in-flight jobs.
 */
@Entity
@Table(
        name = "generation_jobs",
        uniqueConstraints = @UniqueConstraint(name = "uk_generation_jobs_active_key", columnNames = "active_key"),
        indexes = {
                @Index(name = "idx_generation_jobs_status_updated", columnList = "status, updated_at"),
                @Index(name = "idx_generation_jobs_owner", columnList = "owner_id")
        })
public class GenerationJobEntity {

    @Id
    @Column(name = "id", length = 36, nullable = false, updatable = false)
    private String id;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false, length = 32)
    private JobType jobType;

    @Column(name = "target_id", nullable = false)
    private String targetId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private JobStatus status;

    @Column(name = "active_key", length = 800)
    private String activeKey;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "result", length = 8000)
    private Map<String, Object> result;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected GenerationJobEntity() {
    }

    public GenerationJobEntity(
            String id,
            String ownerId,
            JobType jobType,
            String targetId,
            JobStatus status,
            String activeKey,
            Instant createdAt) {
        this.id = id;
        this.ownerId = ownerId;
        this.jobType = jobType;
        this.targetId = targetId;
        this.status = status;
        this.activeKey = activeKey;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public JobType getJobType() {
        return jobType;
    }

    public String getTargetId() {
        return targetId;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public String getActiveKey() {
        return activeKey;
    }

    public void setActiveKey(String activeKey) {
        this.activeKey = activeKey;
    }

    public Map<String, Object> getResult() {
        return result;
    }

    public void setResult(Map<String, Object> result) {
        this.result = result;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
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
