package com.scholary.poster.api;

import com.scholary.poster.service.PosterJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST API for job status.
 *
 * <p>Clients either poll {@code GET /api/jobs/{id}} or subscribe to {@code GET
 * /api/jobs/{id}/events} and receive one {@code job-update} event per change.
 */
@RestController
@RequestMapping("/api/jobs")
@Tag(name = "Jobs", description = "Poster job status and progress")
public class JobController {

  private final PosterJobService jobService;
  private final JobEventStreamer eventStreamer;

  public JobController(PosterJobService jobService, JobEventStreamer eventStreamer) {
    this.jobService = jobService;
    this.eventStreamer = eventStreamer;
  }

  @GetMapping("/{jobId}")
  @Operation(summary = "Get job status", description = "Check the status of a poster job")
  public ResponseEntity<JobStatusResponse> getStatus(@PathVariable String jobId) {
    return jobService
        .find(jobId)
        .map(job -> ResponseEntity.ok(JobStatusResponse.from(job)))
        .orElseThrow(() -> new JobNotFoundException(jobId));
  }

  @GetMapping("/{jobId}/events")
  @Operation(
      summary = "Stream job updates",
      description = "Server-Sent Events stream of job updates, closed after the final state")
  public ResponseEntity<SseEmitter> streamEvents(@PathVariable String jobId) {
    SseEmitter emitter =
        eventStreamer.open(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    return ResponseEntity.ok().contentType(MediaType.TEXT_EVENT_STREAM).body(emitter);
  }

  @DeleteMapping("/{jobId}")
  @Operation(
      summary = "Delete job",
      description = "Remove a job, its rendered image and its gallery entry")
  public ResponseEntity<Void> delete(@PathVariable String jobId) {
    if (!jobService.delete(jobId)) {
      throw new JobNotFoundException(jobId);
    }
    return ResponseEntity.noContent().build();
  }
}
