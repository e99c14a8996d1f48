package com.atasa.audio.processor.extraction;

/**
 * Exception thrown when audio extraction fails.
 *
 * <p>Also thrown when the tool reports success but produced no file.
 */
public class ExtractionException extends RuntimeException {

  public ExtractionException(String message) {
    super(message);
  }

  public ExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
