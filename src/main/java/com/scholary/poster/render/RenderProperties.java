package com.scholary.poster.render;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the external poster renderer.
 *
 * <p>The renderer is a Python script invoked once per job. {@code timeoutSeconds} of 0 means the
 * render may run for as long as it likes.
 */
@ConfigurationProperties(prefix = "render")
@Validated
public record RenderProperties(
    @NotBlank String pythonExecutable,
    @NotBlank String script,
    @NotBlank String workingDir,
    @Positive int executorThreads,
    @PositiveOrZero int executorQueueSize,
    @Positive int maxErrorChars,
    @PositiveOrZero long timeoutSeconds) {

  public Duration timeout() {
    return Duration.ofSeconds(timeoutSeconds);
  }
}
