package com.scholary.poster.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.poster.job.JobSnapshot;
import com.scholary.poster.job.JobStatus;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of a poster job. {@code download_url} is only set once the job has
 * completed.
 */
public record JobStatusResponse(
    @JsonProperty("job_id") String jobId,
    JobStatus status,
    int progress,
    String message,
    String error,
    @JsonProperty("download_url") String downloadUrl) {

  static final String SUBMITTED_MESSAGE =
      "Poster generation started. Poll /api/jobs/{job_id} for status.";

  public static JobStatusResponse from(JobSnapshot snapshot) {
    return new JobStatusResponse(
        snapshot.jobId(),
        snapshot.status(),
        snapshot.progress(),
        snapshot.message(),
        snapshot.error(),
        snapshot.isDownloadAvailable() ? downloadPath(snapshot.jobId()) : null);
  }

  /** Status returned right after submission, with a hint on how to follow the job. */
  static JobStatusResponse submitted(JobSnapshot snapshot) {
    JobStatusResponse current = from(snapshot);
    String message = current.message() != null ? current.message() : SUBMITTED_MESSAGE;
    return new JobStatusResponse(
        current.jobId(),
        current.status(),
        current.progress(),
        message,
        current.error(),
        current.downloadUrl());
  }

  static String downloadPath(String jobId) {
    return "/api/posters/" + jobId;
  }
}
