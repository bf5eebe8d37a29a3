package github.sarthakdev143.film_factory.store;

import github.sarthakdev143.film_factory.model.FilmJobStatus;
import github.sarthakdev143.film_factory.store.entity.FilmJobEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface FilmJobRepository extends JpaRepository<FilmJobEntity, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select f from FilmJobEntity f where f.filmId = :filmId")
    Optional<FilmJobEntity> findForUpdate(@Param("filmId") String filmId);

    List<FilmJobEntity> findByStatusIn(Collection<FilmJobStatus> statuses);
}
