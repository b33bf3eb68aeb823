package com.scholary.poster.job;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merge rules for job records.
 *
 * <p>Allowed transitions:
 *
 * <pre>
 * PENDING ──► PROCESSING ──► COMPLETED
 *    │            │    └───► FAILED
 *    └────────────┴────────► COMPLETED | FAILED
 * </pre>
 *
 * <p>PROCESSING may be re-applied any number of times with new progress and message values. Once
 * a record is terminal every further update is ignored, which makes duplicate completion signals
 * harmless. Progress is kept below 100 until the record completes, and COMPLETED always carries
 * 100.
 */
public final class JobStateMachine {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobStateMachine.class);

  private static final int MAX_RUNNING_PROGRESS = 99;

  private JobStateMachine() {}

  /**
   * Merge an update into the current record.
   *
   * @param current the current record
   * @param update the fields to merge
   * @return the merged record, or empty if the transition is not allowed
   * @throws IllegalJobUpdateException if the update would break the error/status invariant
   */
  public static Optional<JobSnapshot> apply(JobSnapshot current, JobUpdate update) {
    if (current.isTerminal()) {
      LOGGER.debug(
          "Ignoring update for terminal job: jobId={}, status={}, update={}",
          current.jobId(),
          current.status(),
          update);
      return Optional.empty();
    }

    JobStatus target = update.status() != null ? update.status() : current.status();
    if (!canTransition(current.status(), target)) {
      LOGGER.warn(
          "Ignoring invalid transition: jobId={}, {} -> {}", current.jobId(), current.status(), target);
      return Optional.empty();
    }

    if (update.error() != null && target != JobStatus.FAILED) {
      throw new IllegalJobUpdateException(
          "Error detail may only be set together with FAILED (job " + current.jobId() + ")");
    }

    String error = null;
    if (target == JobStatus.FAILED) {
      error = update.error();
      if (error == null || error.isBlank()) {
        throw new IllegalJobUpdateException(
            "FAILED requires an error detail (job " + current.jobId() + ")");
      }
    }

    int progress = update.progress() != null ? update.progress() : current.progress();
    progress = Math.max(0, progress);
    progress = target == JobStatus.COMPLETED ? 100 : Math.min(progress, MAX_RUNNING_PROGRESS);

    String message = update.message() != null ? update.message() : current.message();

    return Optional.of(
        new JobSnapshot(
            current.jobId(),
            target,
            progress,
            message,
            error,
            current.request(),
            current.createdAt()));
  }

  /** Whether {@code from -> to} is an allowed edge. Self-transitions of PROCESSING are allowed. */
  public static boolean canTransition(JobStatus from, JobStatus to) {
    if (from.isTerminal()) {
      return false;
    }
    if (to == JobStatus.PENDING) {
      return from == JobStatus.PENDING;
    }
    return true;
  }
}
