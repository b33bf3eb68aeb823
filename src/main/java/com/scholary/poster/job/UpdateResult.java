package com.scholary.poster.job;

/** Outcome of {@link JobStore#update(String, JobUpdate)}. */
public enum UpdateResult {
  /** The update was merged and published. */
  APPLIED,
  /** No record exists for the job id (never created, deleted or expired). */
  NOT_FOUND,
  /** The record exists but the state machine refused the transition; nothing changed. */
  IGNORED
}
