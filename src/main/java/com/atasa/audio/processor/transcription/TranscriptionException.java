package com.atasa.audio.processor.transcription;

/**
 * Exception thrown when a transcription provider call fails.
 *
 * <p>This covers network failures and interrupted waits. Failures reported by the provider itself
 * use the more specific subclasses.
 */
public class TranscriptionException extends RuntimeException {

  public TranscriptionException(String message) {
    super(message);
  }

  public TranscriptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
