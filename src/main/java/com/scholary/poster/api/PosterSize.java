package com.scholary.poster.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Size presets understood by the renderer.
 *
 * <p>{@link #AUTO} lets the renderer pick a radius from the location, so it is never passed on the
 * command line.
 */
public enum PosterSize {
  AUTO("auto"),
  NEIGHBORHOOD("neighborhood"),
  SMALL("small"),
  TOWN("town"),
  CITY("city"),
  METRO("metro"),
  REGION("region");

  private final String id;

  PosterSize(String id) {
    this.id = id;
  }

  @JsonValue
  public String id() {
    return id;
  }

  @JsonCreator
  public static PosterSize fromId(String id) {
    if (id == null) {
      return AUTO;
    }
    for (PosterSize size : values()) {
      if (size.id.equalsIgnoreCase(id.trim())) {
        return size;
      }
    }
    throw new IllegalArgumentException(
        String.format("Invalid size '%s'. Must be one of: %s", id, validIds()));
  }

  public static String validIds() {
    return Arrays.stream(values()).map(PosterSize::id).collect(Collectors.joining(", "));
  }
}
