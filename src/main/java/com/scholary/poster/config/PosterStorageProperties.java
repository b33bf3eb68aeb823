package com.scholary.poster.config;

import jakarta.validation.constraints.NotBlank;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Where rendered posters and theme definitions live on disk.
 *
 * <p>Maps to the "poster.*" keys in application.yml.
 */
@ConfigurationProperties(prefix = "poster")
@Validated
public record PosterStorageProperties(@NotBlank String dataDir, @NotBlank String themesDir) {

  /** The image file a job renders to. */
  public Path posterFile(String jobId) {
    return Paths.get(dataDir).resolve(jobId + ".png");
  }

  public Path themesPath() {
    return Paths.get(themesDir);
  }
}
