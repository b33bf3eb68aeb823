package com.scholary.poster.render;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Launches the renderer as an operating system process.
 *
 * <p>Arguments are passed as a list through {@link ProcessBuilder}, so city names with spaces or
 * quotes reach the script intact. Standard error is drained on its own daemon thread while the
 * caller reads standard output; if either pipe filled up unread, the renderer would stall.
 */
@Component
public class ProcessRenderLauncher implements RenderLauncher {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessRenderLauncher.class);

  private final int maxErrorChars;

  public ProcessRenderLauncher(RenderProperties properties) {
    this.maxErrorChars = properties.maxErrorChars();
  }

  @Override
  public RenderProcess launch(RenderCommand command) throws IOException {
    Files.createDirectories(command.outputFile().toAbsolutePath().getParent());

    ProcessBuilder builder = new ProcessBuilder(command.arguments());
    builder.directory(command.workingDirectory().toFile());
    builder.environment().putAll(command.environment());

    LOGGER.debug("Executing: {}", String.join(" ", command.arguments()));
    Process process = builder.start();
    return new SystemRenderProcess(process, maxErrorChars);
  }

  /** {@link RenderProcess} backed by a {@link Process}. */
  static final class SystemRenderProcess implements RenderProcess {

    private static final long STDERR_JOIN_MS = 5000;

    private final Process process;
    private final int maxErrorChars;
    private final StringBuilder stderr = new StringBuilder();
    private final Thread stderrDrainer;

    SystemRenderProcess(Process process, int maxErrorChars) {
      this.process = process;
      this.maxErrorChars = maxErrorChars;
      this.stderrDrainer = new Thread(this::drainErrorStream, "render-stderr-" + process.pid());
      this.stderrDrainer.setDaemon(true);
      this.stderrDrainer.start();
    }

    @Override
    public void forEachOutputLine(Consumer<String> consumer) throws IOException {
      try (BufferedReader reader =
          new BufferedReader(
              new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8), 8192)) {
        String line;
        while ((line = reader.readLine()) != null) {
          consumer.accept(line);
        }
      }
    }

    @Override
    public int waitFor() throws InterruptedException {
      int exitCode = process.waitFor();
      stderrDrainer.join(STDERR_JOIN_MS);
      return exitCode;
    }

    @Override
    public String errorOutput() {
      synchronized (stderr) {
        return stderr.toString();
      }
    }

    @Override
    public void destroy() {
      process.descendants().forEach(ProcessHandle::destroyForcibly);
      process.destroyForcibly();
    }

    private void drainErrorStream() {
      char[] buffer = new char[1024];
      try (Reader reader =
          new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8)) {
        int read;
        while ((read = reader.read(buffer)) != -1) {
          append(buffer, read);
        }
      } catch (IOException e) {
        LOGGER.debug("Renderer stderr closed: {}", e.getMessage());
      }
    }

    // Keeps only the tail.
    private void append(char[] chunk, int length) {
      synchronized (stderr) {
        stderr.append(chunk, 0, length);
        int overflow = stderr.length() - maxErrorChars;
        if (overflow > 0) {
          stderr.delete(0, overflow);
        }
      }
    }
  }
}
