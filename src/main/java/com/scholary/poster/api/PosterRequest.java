package com.scholary.poster.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request for rendering a map poster.
 *
 * <p>All renders are asynchronous - the API returns a job ID immediately and the client polls
 * /api/jobs/{id} or subscribes to /api/jobs/{id}/events for progress.
 *
 * <p>Instances are immutable and travel unchanged with the job for its whole lifetime.
 */
public record PosterRequest(
    @NotBlank @Size(max = 100) String city,
    @Size(max = 100) String state,
    @NotBlank @Size(max = 100) String country,
    String theme,
    PosterSize size,
    @Min(1000) @Max(50000) Integer distance,
    Boolean addToGallery) {

  public static final String DEFAULT_THEME = "feature_based";

  // Provide defaults
  public PosterRequest {
    if (state != null && state.isBlank()) {
      state = null;
    }
    if (theme == null || theme.isBlank()) {
      theme = DEFAULT_THEME;
    }
    if (size == null) {
      size = PosterSize.AUTO;
    }
    if (addToGallery == null) {
      addToGallery = false;
    }
  }

  /** Convenience factory for the common case without subdivision, radius or gallery listing. */
  public static PosterRequest of(String city, String country, String theme, PosterSize size) {
    return new PosterRequest(city, null, country, theme, size, null, false);
  }
}
