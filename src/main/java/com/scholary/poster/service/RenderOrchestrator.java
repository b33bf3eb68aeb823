package com.scholary.poster.service;

import com.scholary.poster.api.PosterRequest;
import com.scholary.poster.gallery.GalleryStore;
import com.scholary.poster.job.JobStore;
import com.scholary.poster.job.JobUpdate;
import com.scholary.poster.job.UpdateResult;
import com.scholary.poster.logging.StructuredLogger;
import com.scholary.poster.render.ProgressClassifier;
import com.scholary.poster.render.ProgressSignal;
import com.scholary.poster.render.RenderCommand;
import com.scholary.poster.render.RenderCommandBuilder;
import com.scholary.poster.render.RenderLauncher;
import com.scholary.poster.render.RenderProcess;
import com.scholary.poster.render.RenderProperties;
import com.scholary.poster.theme.ThemeCatalog;
import com.scholary.poster.theme.ThemeInfo;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives one poster render from PENDING to a terminal state.
 *
 * <p>Flow:
 *
 * <ol>
 *   <li>Mark the job PROCESSING
 *   <li>Launch the renderer
 *   <li>Turn each stdout line into a progress update where possible
 *   <li>On exit 0, hand off to the gallery if requested, then mark COMPLETED
 *   <li>Otherwise mark FAILED with the renderer's stderr
 * </ol>
 *
 * <p>Every run ends with exactly one terminal update. {@link #run} blocks for the whole render and
 * is meant to be called on the render executor.
 */
@Service
public class RenderOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(RenderOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String STARTING_MESSAGE = "Starting poster generation...";
  static final String SUCCESS_MESSAGE = "Poster generated successfully!";
  static final int STARTING_PROGRESS = 5;

  private final JobStore jobStore;
  private final RenderCommandBuilder commandBuilder;
  private final RenderLauncher launcher;
  private final ProgressClassifier classifier;
  private final GalleryStore galleryStore;
  private final ThemeCatalog themeCatalog;
  private final Duration timeout;
  private final ScheduledExecutorService watchdog;

  public RenderOrchestrator(
      JobStore jobStore,
      RenderCommandBuilder commandBuilder,
      RenderLauncher launcher,
      ProgressClassifier classifier,
      GalleryStore galleryStore,
      ThemeCatalog themeCatalog,
      RenderProperties renderProperties) {
    this.jobStore = jobStore;
    this.commandBuilder = commandBuilder;
    this.launcher = launcher;
    this.classifier = classifier;
    this.galleryStore = galleryStore;
    this.themeCatalog = themeCatalog;
    this.timeout = renderProperties.timeout();
    this.watchdog =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, "render-watchdog");
              thread.setDaemon(true);
              return thread;
            });
  }

  /**
   * Render the poster for a job.
   *
   * <p>Does nothing if the job no longer exists or has already left PENDING.
   *
   * @param jobId the job to run
   * @param request the job's request
   */
  public void run(String jobId, PosterRequest request) {
    StructuredLogger.setJobContext(jobId, request.city(), request.theme());
    try {
      UpdateResult started =
          jobStore.update(jobId, JobUpdate.processing(STARTING_PROGRESS, STARTING_MESSAGE));
      if (started != UpdateResult.APPLIED) {
        LOGGER.warn("Job {} not started: {}", jobId, started);
        return;
      }
      render(jobId, request);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private void render(String jobId, PosterRequest request) {
    RenderCommand command = commandBuilder.build(jobId, request);
    long startTime = System.currentTimeMillis();

    RenderProcess process;
    try {
      structuredLogger.logRenderStarted(jobId, command.arguments());
      process = launcher.launch(command);
    } catch (IOException e) {
      structuredLogger.logRenderFailed(jobId, null, "LaunchFailed", e.getMessage());
      fail(jobId, "Failed to start renderer: " + e.getMessage());
      return;
    }

    AtomicBoolean timedOut = new AtomicBoolean(false);
    ScheduledFuture<?> timer = scheduleTimeout(process, timedOut);
    AtomicInteger ignoredLines = new AtomicInteger();

    try {
      try {
        process.forEachOutputLine(line -> onOutputLine(jobId, line, ignoredLines));
      } catch (IOException e) {
        // The exit code decides the outcome; a broken stdout pipe alone does not.
        LOGGER.warn("Error reading renderer output for job {}: {}", jobId, e.getMessage());
      }

      int exitCode = process.waitFor();
      long durationMs = System.currentTimeMillis() - startTime;

      if (exitCode != 0 && timedOut.get()) {
        String message = "Render timed out after " + timeout.getSeconds() + "s";
        structuredLogger.logRenderFailed(jobId, exitCode, "Timeout", message);
        fail(jobId, message);
        return;
      }

      if (exitCode != 0) {
        String stderr = process.errorOutput() == null ? "" : process.errorOutput().trim();
        String error = stderr.isEmpty() ? "Process exited with code " + exitCode : stderr;
        structuredLogger.logRenderFailed(jobId, exitCode, "NonZeroExit", error);
        fail(jobId, error);
        return;
      }

      if (timedOut.get()) {
        LOGGER.info("Renderer for job {} exited cleanly as the timeout fired", jobId);
      }
      structuredLogger.logRenderFinished(jobId, exitCode, durationMs, ignoredLines.get());
      if (Boolean.TRUE.equals(request.addToGallery())) {
        addToGallery(jobId, request);
      }
      jobStore.update(jobId, JobUpdate.completed(SUCCESS_MESSAGE));

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroy();
      structuredLogger.logRenderFailed(jobId, null, "Interrupted", "Render interrupted");
      fail(jobId, "Render interrupted");
    } finally {
      if (timer != null) {
        timer.cancel(false);
      }
    }
  }

  private void onOutputLine(String jobId, String line, AtomicInteger ignoredLines) {
    try {
      Optional<ProgressSignal> signal = classifier.classify(line);
      if (signal.isEmpty()) {
        ignoredLines.incrementAndGet();
        LOGGER.debug("Ignored renderer output: {}", line);
        return;
      }
      ProgressSignal progress = signal.get();
      structuredLogger.logJobProgress(jobId, progress.progress(), progress.message());
      jobStore.update(jobId, JobUpdate.progress(progress.progress(), progress.message()));
    } catch (RuntimeException e) {
      ignoredLines.incrementAndGet();
      LOGGER.warn("Failed to apply progress line for job {}: {}", jobId, e.getMessage());
    }
  }

  private void addToGallery(String jobId, PosterRequest request) {
    try {
      ThemeInfo theme = themeCatalog.find(request.theme()).orElse(null);
      galleryStore.add(jobId, request, theme);
      structuredLogger.logGalleryHandoff(jobId, theme != null ? theme.name() : request.theme());
    } catch (RuntimeException e) {
      LOGGER.warn("Failed to add job {} to gallery: {}", jobId, e.getMessage());
    }
  }

  private void fail(String jobId, String error) {
    UpdateResult result = jobStore.update(jobId, JobUpdate.failed(error));
    if (result != UpdateResult.APPLIED) {
      LOGGER.debug("Failure for job {} not recorded: {}", jobId, result);
    }
  }

  private ScheduledFuture<?> scheduleTimeout(RenderProcess process, AtomicBoolean timedOut) {
    if (timeout.isZero()) {
      return null;
    }
    return watchdog.schedule(
        () -> {
          timedOut.set(true);
          LOGGER.warn("Render exceeded {}s, destroying process", timeout.getSeconds());
          process.destroy();
        },
        timeout.toMillis(),
        TimeUnit.MILLISECONDS);
  }

  @PreDestroy
  public void shutdown() {
    watchdog.shutdownNow();
  }
}
