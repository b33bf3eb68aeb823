package com.scholary.poster.render;

import java.io.IOException;
import java.util.function.Consumer;

/** A running renderer. */
public interface RenderProcess {

  /**
   * Feed each standard output line to the consumer, in order, until the stream closes.
   *
   * @throws IOException if reading the stream fails
   */
  void forEachOutputLine(Consumer<String> consumer) throws IOException;

  /**
   * Wait for the process to exit.
   *
   * @return the exit code; 0 means success
   * @throws InterruptedException if interrupted while waiting
   */
  int waitFor() throws InterruptedException;

  /** Standard error collected so far. Diagnostic only, never parsed. */
  String errorOutput();

  /** Kill the process. Standard output closes shortly afterwards. */
  void destroy();
}
