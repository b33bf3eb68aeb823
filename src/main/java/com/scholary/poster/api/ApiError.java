package com.scholary.poster.api;

import java.util.List;

/**
 * Error body returned by the API.
 *
 * <p>{@code detail} is either a plain message or, for request validation failures, a list of
 * {@link Violation}s.
 */
public record ApiError(Object detail) {

  public static ApiError of(String message) {
    return new ApiError(message);
  }

  public static ApiError of(List<Violation> violations) {
    return new ApiError(List.copyOf(violations));
  }

  /** One rejected request field. {@code loc} is the path to it, e.g. {@code ["body", "city"]}. */
  public record Violation(String type, List<String> loc, String msg) {}
}
