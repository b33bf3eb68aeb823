package com.scholary.poster.logging;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log render lifecycle events with structured fields that can be queried in
 * the log backend (e.g. {@code event_type:render_failed AND jobId:"..."}).
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log render launch event. */
  public void logRenderStarted(String jobId, List<String> command) {
    try {
      MDC.put("event_type", "render_started");
      MDC.put("jobId", jobId);

      logger.info("Render started: jobId={}, command={}", jobId, String.join(" ", command));
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event derived from renderer output. */
  public void logJobProgress(String jobId, Integer progress, String message) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("jobId", jobId);
      MDC.put("progress", String.valueOf(progress));

      logger.debug("Job progress: jobId={}, progress={}%, message={}", jobId, progress, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log successful render completion. */
  public void logRenderFinished(String jobId, int exitCode, long durationMs, int ignoredLines) {
    try {
      MDC.put("event_type", "render_finished");
      MDC.put("jobId", jobId);
      MDC.put("exitCode", String.valueOf(exitCode));
      MDC.put("durationMs", String.valueOf(durationMs));
      MDC.put("ignoredLines", String.valueOf(ignoredLines));

      logger.info(
          "Render finished: jobId={}, exitCode={}, duration={}ms, ignoredLines={}",
          jobId,
          exitCode,
          durationMs,
          ignoredLines);
    } finally {
      clearEventFields();
    }
  }

  /** Log render failure event. */
  public void logRenderFailed(String jobId, Integer exitCode, String errorType, String message) {
    try {
      MDC.put("event_type", "render_failed");
      MDC.put("jobId", jobId);
      MDC.put("exitCode", String.valueOf(exitCode));
      MDC.put("errorType", errorType);

      logger.error(
          "Render failed: jobId={}, exitCode={}, error={}, message={}",
          jobId,
          exitCode,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log gallery hand-off for a completed job. */
  public void logGalleryHandoff(String jobId, String themeName) {
    try {
      MDC.put("event_type", "gallery_added");
      MDC.put("jobId", jobId);

      logger.info("Added to gallery: jobId={}, theme={}", jobId, themeName);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String city, String theme) {
    MDC.put("jobId", jobId);
    MDC.put("city", city);
    MDC.put("theme", theme);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("city");
    MDC.remove("theme");
  }

  /**
   * Clear event-specific fields from MDC.
   *
   * <p>{@code jobId} is left alone when a job context is active on this thread.
   */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("progress");
    MDC.remove("exitCode");
    MDC.remove("durationMs");
    MDC.remove("ignoredLines");
    MDC.remove("errorType");
    if (MDC.get("city") == null) {
      MDC.remove("jobId");
    }
  }
}
