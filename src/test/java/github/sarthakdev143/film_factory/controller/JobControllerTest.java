package github.sarthakdev143.film_factory.controller;

import github.sarthakdev143.film_factory.model.GenerationJob;
import github.sarthakdev143.film_factory.model.JobStatus;
import github.sarthakdev143.film_factory.model.JobType;
import github.sarthakdev143.film_factory.store.JobStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(JobController.class)
class JobControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private JobStore jobStore;

    @Test
    void getJobReturnsStatusAndResult() throws Exception {
        GenerationJob job = new GenerationJob(
                "job-1",
                "owner-1",
                JobType.CLIP,
                "film-1:shot-2",
                JobStatus.COMPLETED,
                Map.of("artifact_ref", "/artifacts/clips/2.mp4"),
                null,
                Instant.parse("2026-03-01T10:00:00Z"),
                Instant.parse("2026-03-01T10:02:00Z"));
        when(jobStore.find("job-1")).thenReturn(Optional.of(job));

        mockMvc.perform(get("/api/jobs/job-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobId").value("job-1"))
                .andExpect(jsonPath("$.jobType").value("clip"))
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.result.artifact_ref").value("/artifacts/clips/2.mp4"));
    }

    @Test
    void getJobReturnsNotFound() throws Exception {
        when(jobStore.find("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/jobs/nope"))
                .andExpect(status().isNotFound())
                .andExpect(content().string("Job not found for id: nope"));
    }
}
