package com.scholary.poster.render;

import com.scholary.poster.api.PosterRequest;
import com.scholary.poster.api.PosterSize;
import com.scholary.poster.config.PosterStorageProperties;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Translates a poster request into the renderer's command line.
 *
 * <p>Arguments map 1:1 onto request fields:
 *
 * <pre>
 * python3 create_map_poster.py --city C --country K --theme T --output DATA/JOB.png
 *     [--state S] [--size Z] [--distance D]
 * </pre>
 *
 * <p>{@code --size} is left out for {@link PosterSize#AUTO} so the renderer picks its own radius.
 */
@Component
public class RenderCommandBuilder {

  private final RenderProperties renderProperties;
  private final PosterStorageProperties storageProperties;

  public RenderCommandBuilder(
      RenderProperties renderProperties, PosterStorageProperties storageProperties) {
    this.renderProperties = renderProperties;
    this.storageProperties = storageProperties;
  }

  public RenderCommand build(String jobId, PosterRequest request) {
    Path workingDir = Paths.get(renderProperties.workingDir());
    Path outputFile = storageProperties.posterFile(jobId).toAbsolutePath();

    List<String> args = new ArrayList<>();
    args.add(renderProperties.pythonExecutable());
    args.add(workingDir.resolve(renderProperties.script()).toString());
    args.add("--city");
    args.add(request.city());
    args.add("--country");
    args.add(request.country());
    args.add("--theme");
    args.add(request.theme());
    args.add("--output");
    args.add(outputFile.toString());

    if (request.state() != null) {
      args.add("--state");
      args.add(request.state());
    }

    if (request.size() != PosterSize.AUTO) {
      args.add("--size");
      args.add(request.size().id());
    }

    if (request.distance() != null) {
      args.add("--distance");
      args.add(String.valueOf(request.distance()));
    }

    return new RenderCommand(args, workingDir, outputFile, Map.of("PYTHONUNBUFFERED", "1"));
  }
}
