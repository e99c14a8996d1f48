package com.atasa.audio.processor.extraction;

/** The extraction tool could not be started, exited with a nonzero code, or timed out. */
public class ToolInvocationException extends ExtractionException {

  public ToolInvocationException(String message) {
    super(message);
  }

  public ToolInvocationException(String message, Throwable cause) {
    super(message, cause);
  }
}
