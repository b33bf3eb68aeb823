package com.scholary.poster.job;

import com.scholary.poster.api.PosterRequest;
import java.time.Instant;

/**
 * Immutable point-in-time value of a poster job.
 *
 * <p>The {@link JobStore} is the only place new snapshots are produced. Everything else (the
 * orchestrator, the notification hub, HTTP handlers) only ever sees copies, so a snapshot can be
 * handed to any thread without further synchronization.
 */
public record JobSnapshot(
    String jobId,
    JobStatus status,
    int progress,
    String message,
    String error,
    PosterRequest request,
    Instant createdAt) {

  static JobSnapshot pending(String jobId, PosterRequest request, Instant createdAt) {
    return new JobSnapshot(jobId, JobStatus.PENDING, 0, null, null, request, createdAt);
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }

  /** The rendered image may only be downloaded once the job has completed. */
  public boolean isDownloadAvailable() {
    return status == JobStatus.COMPLETED;
  }
}
