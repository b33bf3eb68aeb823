package com.scholary.poster.job;

/**
 * Partial set of fields to merge into a job record.
 *
 * <p>A {@code null} component means "leave unchanged". Use the static factories rather than the
 * canonical constructor so that call sites read as the transition they request.
 */
public record JobUpdate(JobStatus status, Integer progress, String message, String error) {

  public static JobUpdate progress(int progress) {
    return new JobUpdate(null, progress, null, null);
  }

  public static JobUpdate progress(Integer progress, String message) {
    return new JobUpdate(null, progress, message, null);
  }

  public static JobUpdate processing(int progress, String message) {
    return new JobUpdate(JobStatus.PROCESSING, progress, message, null);
  }

  public static JobUpdate completed(String message) {
    return new JobUpdate(JobStatus.COMPLETED, 100, message, null);
  }

  public static JobUpdate failed(String error) {
    return new JobUpdate(JobStatus.FAILED, null, null, error);
  }
}
