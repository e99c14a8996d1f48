package com.atasa.audio.processor.transcription;

/** The provider answered with an error, either an error status or an error field in its body. */
public class ProviderException extends TranscriptionException {

  public ProviderException(String message) {
    super(message);
  }
}
