package github.sarthakdev143.film_factory.store;

import github.sarthakdev143.film_factory.model.JobStatus;
import github.sarthakdev143.film_factory.model.JobType;
import github.sarthakdev143.film_factory.store.entity.GenerationJobEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface GenerationJobRepository extends JpaRepository<GenerationJobEntity, String> {

    Optional<GenerationJobEntity> findByActiveKey(String activeKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select j from GenerationJobEntity j where j.id = :id")
    Optional<GenerationJobEntity> findForUpdate(@Param("id") String id);

    List<GenerationJobEntity> findByStatusAndUpdatedAtBeforeOrderByUpdatedAtAsc(
            JobStatus status,
            Instant cutoff,
            Pageable pageable);

    List<GenerationJobEntity> findByStatusAndJobTypeOrderByCreatedAtAsc(JobStatus status, JobType jobType);

    List<GenerationJobEntity> findByStatusOrderByCreatedAtAsc(JobStatus status);
}
