package com.scholary.poster.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.poster.config.PosterStorageProperties;
import com.scholary.poster.job.JobSnapshot;
import com.scholary.poster.job.JobStatus;
import com.scholary.poster.service.PosterJobService;
import com.scholary.poster.theme.ThemeCatalog;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class PosterControllerTest {

  @Mock private PosterJobService jobService;
  @Mock private ThemeCatalog themeCatalog;

  @TempDir Path tempDir;

  private PosterStorageProperties storageProperties;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    storageProperties = new PosterStorageProperties(tempDir.toString(), tempDir.toString());
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new PosterController(jobService, themeCatalog, storageProperties))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
  }

  @Test
  void create_shouldReturnPendingJob() throws Exception {
    when(themeCatalog.exists("noir")).thenReturn(true);
    when(jobService.submit(any()))
        .thenAnswer(
            invocation ->
                new JobSnapshot(
                    "job-1",
                    JobStatus.PENDING,
                    0,
                    null,
                    null,
                    invocation.getArgument(0),
                    Instant.now()));

    mockMvc
        .perform(
            post("/api/posters")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"city\": \"Paris\", \"country\": \"France\", \"theme\": \"noir\","
                        + " \"size\": \"city\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.job_id").value("job-1"))
        .andExpect(jsonPath("$.status").value("pending"))
        .andExpect(jsonPath("$.progress").value(0))
        .andExpect(
            jsonPath("$.message")
                .value("Poster generation started. Poll /api/jobs/{job_id} for status."))
        .andExpect(jsonPath("$.download_url").doesNotExist());
  }

  @Test
  void create_shouldRejectMissingCityWith422() throws Exception {
    mockMvc
        .perform(
            post("/api/posters")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"country\": \"France\"}"))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.detail[0].type").value("validation_error"))
        .andExpect(jsonPath("$.detail[0].loc[0]").value("body"))
        .andExpect(jsonPath("$.detail[0].loc[1]").value("city"));

    verify(jobService, never()).submit(any());
  }

  @Test
  void create_shouldRejectDistanceOutOfRange() throws Exception {
    mockMvc
        .perform(
            post("/api/posters")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"city\": \"Paris\", \"country\": \"France\", \"distance\": 500}"))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.detail[0].loc[1]").value("distance"));
  }

  @Test
  void create_shouldRejectUnknownTheme() throws Exception {
    when(themeCatalog.exists("plaid")).thenReturn(false);

    mockMvc
        .perform(
            post("/api/posters")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"city\": \"Paris\", \"country\": \"France\", \"theme\": \"plaid\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("Theme 'plaid' not found"));
  }

  @Test
  void create_shouldRejectUnknownSize() throws Exception {
    mockMvc
        .perform(
            post("/api/posters")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"city\": \"Paris\", \"country\": \"France\", \"size\": \"huge\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(
            jsonPath("$.detail")
                .value(
                    "Invalid size 'huge'. Must be one of: auto, neighborhood, small, town,"
                        + " city, metro, region"));
  }

  @Test
  void download_shouldReturn404ForUnknownJob() throws Exception {
    when(jobService.find("missing")).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/api/posters/missing"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.detail").value("Job not found"));
  }

  @Test
  void download_shouldReturn400WhileJobIsRunning() throws Exception {
    when(jobService.find("job-1")).thenReturn(Optional.of(job(JobStatus.PROCESSING)));

    mockMvc
        .perform(get("/api/posters/job-1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("Poster not ready yet. Status: processing"));
  }

  @Test
  void download_shouldReturn404WhenImageIsMissing() throws Exception {
    when(jobService.find("job-1")).thenReturn(Optional.of(job(JobStatus.COMPLETED)));

    mockMvc
        .perform(get("/api/posters/job-1"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.detail").value("Poster file not found"));
  }

  @Test
  void download_shouldServeCompletedPoster() throws Exception {
    when(jobService.find("job-1")).thenReturn(Optional.of(job(JobStatus.COMPLETED)));
    byte[] png = {(byte) 0x89, 'P', 'N', 'G'};
    Files.write(storageProperties.posterFile("job-1"), png);

    mockMvc
        .perform(get("/api/posters/job-1"))
        .andExpect(status().isOk())
        .andExpect(content().contentType(MediaType.IMAGE_PNG))
        .andExpect(
            header()
                .string(
                    "Content-Disposition", "attachment; filename=\"new_york_noir_poster.png\""))
        .andExpect(content().bytes(png));
  }

  private static JobSnapshot job(JobStatus status) {
    PosterRequest request =
        new PosterRequest("New York", "NY", "USA", "noir", PosterSize.AUTO, null, false);
    int progress = status == JobStatus.COMPLETED ? 100 : 40;
    return new JobSnapshot("job-1", status, progress, null, null, request, Instant.now());
  }
}
