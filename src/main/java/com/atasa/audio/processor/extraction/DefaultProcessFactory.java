package com.atasa.audio.processor.extraction;

import java.io.IOException;
import java.util.List;

/** Production {@link ProcessFactory} backed by {@link ProcessBuilder}. */
final class DefaultProcessFactory implements ProcessFactory {

  @Override
  public Process start(List<String> command) throws IOException {
    ProcessBuilder pb = new ProcessBuilder(command);
    pb.redirectErrorStream(true);
    return pb.start();
  }
}
