package com.scholary.poster.service;

import com.scholary.poster.api.PosterRequest;
import com.scholary.poster.config.PosterStorageProperties;
import com.scholary.poster.gallery.GalleryStore;
import com.scholary.poster.job.JobSnapshot;
import com.scholary.poster.job.JobStore;
import com.scholary.poster.job.JobUpdate;
import com.scholary.poster.notification.JobNotificationHub;
import com.scholary.poster.notification.JobSubscription;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point for poster jobs.
 *
 * <p>Creates jobs and hands them to the render executor. Whatever happens on the worker, the job
 * ends up in a terminal state: an exception escaping the orchestrator or a rejected submission is
 * recorded as FAILED rather than only logged.
 */
@Service
public class PosterJobService {

  private static final Logger LOGGER = LoggerFactory.getLogger(PosterJobService.class);

  static final String BUSY_MESSAGE = "Server is busy, please try again later";

  private final JobStore jobStore;
  private final JobNotificationHub notificationHub;
  private final RenderOrchestrator orchestrator;
  private final GalleryStore galleryStore;
  private final PosterStorageProperties storageProperties;
  private final Executor renderExecutor;

  public PosterJobService(
      JobStore jobStore,
      JobNotificationHub notificationHub,
      RenderOrchestrator orchestrator,
      GalleryStore galleryStore,
      PosterStorageProperties storageProperties,
      @Qualifier("renderExecutor") Executor renderExecutor) {
    this.jobStore = jobStore;
    this.notificationHub = notificationHub;
    this.orchestrator = orchestrator;
    this.galleryStore = galleryStore;
    this.storageProperties = storageProperties;
    this.renderExecutor = renderExecutor;
  }

  /**
   * Create a job and schedule its render.
   *
   * @param request the validated request
   * @return the job as it was right after submission
   */
  public JobSnapshot submit(PosterRequest request) {
    String jobId = jobStore.create(request);
    LOGGER.info(
        "Created poster job {}: city={}, country={}, theme={}",
        jobId,
        request.city(),
        request.country(),
        request.theme());

    try {
      CompletableFuture.runAsync(() -> orchestrator.run(jobId, request), renderExecutor)
          .whenComplete(
              (ignored, error) -> {
                if (error != null) {
                  LOGGER.error("Render job {} failed unexpectedly", jobId, error);
                  jobStore.update(jobId, JobUpdate.failed(rootMessage(error)));
                }
              });
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Render executor saturated, rejecting job {}", jobId);
      jobStore.update(jobId, JobUpdate.failed(BUSY_MESSAGE));
    }

    return jobStore.get(jobId).orElseThrow();
  }

  public Optional<JobSnapshot> find(String jobId) {
    return jobStore.get(jobId);
  }

  /**
   * Observe a job's future updates.
   *
   * <p>If the job has already finished, the subscription yields its terminal snapshot once and
   * then reports itself finished.
   *
   * @return a subscription, or empty if the job is unknown
   */
  public Optional<JobSubscription> subscribe(String jobId) {
    if (jobStore.get(jobId).isEmpty()) {
      return Optional.empty();
    }
    JobSubscription subscription = notificationHub.subscribe(jobId);
    // Re-read after registering so a terminal update is never missed.
    Optional<JobSnapshot> current = jobStore.get(jobId);
    if (current.isEmpty()) {
      notificationHub.unsubscribe(subscription);
      return Optional.empty();
    }
    notificationHub.catchUp(subscription, current.get());
    return Optional.of(subscription);
  }

  public void unsubscribe(JobSubscription subscription) {
    notificationHub.unsubscribe(subscription);
  }

  /**
   * Remove a job together with its rendered image and gallery entry.
   *
   * @return true if the job existed
   */
  public boolean delete(String jobId) {
    boolean removed = jobStore.delete(jobId);
    if (!removed) {
      return false;
    }
    try {
      Files.deleteIfExists(storageProperties.posterFile(jobId));
    } catch (IOException e) {
      LOGGER.warn("Failed to delete poster file for job {}: {}", jobId, e.getMessage());
    }
    galleryStore.remove(jobId);
    return true;
  }

  private static String rootMessage(Throwable error) {
    Throwable root = error;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    String message = root.getMessage();
    return message == null || message.isBlank() ? root.getClass().getSimpleName() : message;
  }
}
