package com.scholary.poster.api;

import com.scholary.poster.config.PosterStorageProperties;
import com.scholary.poster.job.JobSnapshot;
import com.scholary.poster.logging.StructuredLogger;
import com.scholary.poster.service.PosterJobService;
import com.scholary.poster.theme.ThemeCatalog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for poster generation.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Asynchronous poster generation (returns job ID immediately)
 *   <li>Downloading the finished image
 * </ul>
 */
@RestController
@RequestMapping("/api/posters")
@Tag(name = "Posters", description = "Map poster generation API")
public class PosterController {

  private static final Logger LOGGER = LoggerFactory.getLogger(PosterController.class);

  private final PosterJobService jobService;
  private final ThemeCatalog themeCatalog;
  private final PosterStorageProperties storageProperties;

  public PosterController(
      PosterJobService jobService,
      ThemeCatalog themeCatalog,
      PosterStorageProperties storageProperties) {
    this.jobService = jobService;
    this.themeCatalog = themeCatalog;
    this.storageProperties = storageProperties;
  }

  /** Start asynchronous poster generation. */
  @PostMapping
  @Operation(
      summary = "Create poster",
      description = "Start an asynchronous render and return the job for status polling")
  public ResponseEntity<?> create(@Valid @RequestBody PosterRequest request) {
    if (!themeCatalog.exists(request.theme())) {
      return ResponseEntity.badRequest()
          .body(ApiError.of("Theme '" + request.theme() + "' not found"));
    }

    JobSnapshot job = jobService.submit(request);
    try {
      StructuredLogger.setJobContext(job.jobId(), request.city(), request.theme());
      LOGGER.info(
          "Poster request accepted: city={}, country={}, size={}",
          request.city(),
          request.country(),
          request.size().id());
    } finally {
      StructuredLogger.clearJobContext();
    }
    return ResponseEntity.ok(JobStatusResponse.submitted(job));
  }

  /** Download a completed poster image. */
  @GetMapping("/{jobId}")
  @Operation(summary = "Download poster", description = "Download the PNG of a completed job")
  public ResponseEntity<?> download(@PathVariable String jobId) {
    Optional<JobSnapshot> found = jobService.find(jobId);
    if (found.isEmpty()) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiError.of("Job not found"));
    }

    JobSnapshot job = found.get();
    if (!job.isDownloadAvailable()) {
      return ResponseEntity.badRequest()
          .body(ApiError.of("Poster not ready yet. Status: " + job.status().wireName()));
    }

    Path file = storageProperties.posterFile(jobId);
    if (!Files.exists(file)) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND)
          .body(ApiError.of("Poster file not found"));
    }

    ContentDisposition disposition =
        ContentDisposition.attachment().filename(downloadFilename(job.request())).build();
    return ResponseEntity.ok()
        .contentType(MediaType.IMAGE_PNG)
        .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
        .body(new FileSystemResource(file));
  }

  static String downloadFilename(PosterRequest request) {
    String citySlug = request.city().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
    return citySlug + "_" + request.theme() + "_poster.png";
  }
}
