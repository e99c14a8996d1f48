package com.atasa.audio.processor.extraction;

import java.io.IOException;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so the extractor can be tested without spawning real
 * processes.
 */
interface ProcessFactory {

  /**
   * Start a process whose stderr is merged into stdout.
   *
   * @param command full command line, executable first
   * @return the started process
   * @throws IOException if the process cannot be started
   */
  Process start(List<String> command) throws IOException;
}
