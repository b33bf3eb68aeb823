package com.scholary.poster.job;

/**
 * Thrown when a caller asks the store for an update that would break a record invariant.
 *
 * <p>This signals a programming error in the caller, not a runtime condition: late or duplicate
 * terminal updates are silently ignored instead.
 */
public class IllegalJobUpdateException extends RuntimeException {

  public IllegalJobUpdateException(String message) {
    super(message);
  }
}
