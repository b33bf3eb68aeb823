package com.scholary.poster.render;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * A fully resolved renderer invocation.
 *
 * @param arguments executable followed by its arguments
 * @param workingDirectory directory the process runs in
 * @param outputFile image file the renderer is asked to write
 * @param environment variables added to the inherited environment
 */
public record RenderCommand(
    List<String> arguments,
    Path workingDirectory,
    Path outputFile,
    Map<String, String> environment) {

  public RenderCommand {
    arguments = List.copyOf(arguments);
    environment = Map.copyOf(environment);
  }
}
