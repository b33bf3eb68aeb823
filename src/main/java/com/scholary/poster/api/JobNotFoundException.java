package com.scholary.poster.api;

/** Thrown by handlers when the requested job does not exist. */
public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(String jobId) {
    super("Job not found: " + jobId);
  }
}
