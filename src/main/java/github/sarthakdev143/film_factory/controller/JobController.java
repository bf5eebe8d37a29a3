package github.sarthakdev143.film_factory.controller;

import github.sarthakdev143.film_factory.dto.JobStatusResponse;
import github.sarthakdev143.film_factory.store.JobStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/jobs")
public class JobController {

    private final JobStore jobStore;

    public JobController(JobStore jobStore) {
        this.jobStore = jobStore;
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<?> getJob(@PathVariable String jobId) {
        return jobStore.find(jobId)
                .<ResponseEntity<?>>map(job -> ResponseEntity.ok(JobStatusResponse.from(job)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Job not found for id: " + jobId));
    }
}
