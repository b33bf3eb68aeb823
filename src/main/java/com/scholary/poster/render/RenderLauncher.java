package com.scholary.poster.render;

import java.io.IOException;

/**
 * Starts renderer processes.
 *
 * <p>This abstraction keeps process spawning out of the orchestrator, so the orchestration logic
 * can be tested with scripted output instead of a real Python installation.
 */
public interface RenderLauncher {

  /**
   * Start the renderer.
   *
   * @param command the resolved command
   * @return the running process
   * @throws IOException if the process cannot be started at all
   */
  RenderProcess launch(RenderCommand command) throws IOException;
}
