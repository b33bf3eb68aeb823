package com.scholary.poster.job;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Lifecycle states of a poster job. COMPLETED and FAILED are terminal. */
public enum JobStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
