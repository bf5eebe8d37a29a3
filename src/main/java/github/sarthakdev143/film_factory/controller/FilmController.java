package github.sarthakdev143.film_factory.controller;

import github.sarthakdev143.film_factory.dto.FilmShotRequest;
import github.sarthakdev143.film_factory.dto.FilmStatusResponse;
import github.sarthakdev143.film_factory.dto.FilmSubmissionResponse;
import github.sarthakdev143.film_factory.dto.RegenerateShotRequest;
import github.sarthakdev143.film_factory.dto.StartFilmRequest;
import github.sarthakdev143.film_factory.model.FilmJobStatus;
import github.sarthakdev143.film_factory.model.ShotSpec;
import github.sarthakdev143.film_factory.service.FilmNotFoundException;
import github.sarthakdev143.film_factory.service.ShotPipelineOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/films")
public class FilmController {

    private static final Logger logger = LoggerFactory.getLogger(FilmController.class);
    private static final int MAX_SHOTS = 50;
    private static final int MAX_PROMPT_LENGTH = 4000;
    private static final int MAX_FEEDBACK_LENGTH = 1000;
    private static final int MIN_DURATION_SECONDS = 4;
    private static final int MAX_DURATION_SECONDS = 12;

    private final ShotPipelineOrchestrator orchestrator;

    public FilmController(ShotPipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public ResponseEntity<?> startFilm(@RequestBody(required = false) StartFilmRequest request) {
        try {
            List<ShotSpec> shots = validateAndBuildShots(request);
            String filmId = orchestrator.startFilm(request.ownerId().trim(), shots);
            return ResponseEntity.accepted()
                    .body(new FilmSubmissionResponse(
                            filmId,
                            FilmJobStatus.GENERATING.toApiValue(),
                            "Film accepted. Poll /api/films/{filmId} for progress."));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Film submission failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to start film generation. Please try again.");
        }
    }

    @GetMapping("/{filmId}")
    public ResponseEntity<?> getFilm(@PathVariable String filmId) {
        return orchestrator.find(filmId)
                .<ResponseEntity<?>>map(film -> ResponseEntity.ok(FilmStatusResponse.from(film)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Film not found for id: " + filmId));
    }

    @PostMapping("/{filmId}/shots/{shotNumber}/regenerate")
    public ResponseEntity<?> regenerateShot(
            @PathVariable String filmId,
            @PathVariable int shotNumber,
            @RequestBody(required = false) RegenerateShotRequest request) {
        String feedback = request == null ? null : request.feedback();
        try {
            if (feedback != null && feedback.length() > MAX_FEEDBACK_LENGTH) {
                throw new IllegalArgumentException("feedback must be at most " + MAX_FEEDBACK_LENGTH + " characters.");
            }
            orchestrator.regenerateShot(filmId, shotNumber, feedback);
            return ResponseEntity.accepted()
                    .body(new FilmSubmissionResponse(
                            filmId,
                            FilmJobStatus.GENERATING.toApiValue(),
                            "Regenerating shot " + shotNumber + "."));
        } catch (FilmNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Film not found for id: " + filmId);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getMessage());
        } catch (Exception e) {
            logger.error("Shot regeneration failed for film {} shot {}", filmId, shotNumber, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to regenerate shot. Please try again.");
        }
    }

    private List<ShotSpec> validateAndBuildShots(StartFilmRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required.");
        }
        if (request.ownerId() == null || request.ownerId().isBlank()) {
            throw new IllegalArgumentException("ownerId is required.");
        }
        if (request.shots() == null || request.shots().isEmpty()) {
            throw new IllegalArgumentException("At least one shot is required.");
        }
        if (request.shots().size() > MAX_SHOTS) {
            throw new IllegalArgumentException("A maximum of " + MAX_SHOTS + " shots is allowed.");
        }

        List<ShotSpec> shots = new ArrayList<>();
        for (int index = 0; index < request.shots().size(); index++) {
            FilmShotRequest shot = request.shots().get(index);
            if (shot == null) {
                throw new IllegalArgumentException("Shot " + (index + 1) + " is empty.");
            }
            int number = shot.number() == null ? index + 1 : shot.number();
            if (shot.prompt() == null || shot.prompt().isBlank()) {
                throw new IllegalArgumentException("Shot " + number + " needs a prompt.");
            }
            if (shot.prompt().length() > MAX_PROMPT_LENGTH) {
                throw new IllegalArgumentException(
                        "Shot " + number + " prompt must be at most " + MAX_PROMPT_LENGTH + " characters.");
            }
            Integer duration = shot.durationSeconds();
            if (duration != null && (duration < MIN_DURATION_SECONDS || duration > MAX_DURATION_SECONDS)) {
                throw new IllegalArgumentException("Shot " + number + " duration must be between "
                        + MIN_DURATION_SECONDS + " and " + MAX_DURATION_SECONDS + " seconds.");
            }
            shots.add(new ShotSpec(
                    number,
                    shot.prompt().trim(),
                    shot.referenceImageUrl(),
                    duration == null ? ShotSpec.DEFAULT_DURATION_SECONDS : duration));
        }
        return shots;
    }
}
