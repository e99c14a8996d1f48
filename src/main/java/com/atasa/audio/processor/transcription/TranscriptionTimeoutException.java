package com.atasa.audio.processor.transcription;

/** The provider never reported a terminal status within the polling budget. */
public class TranscriptionTimeoutException extends TranscriptionException {

  private final int attempts;

  public TranscriptionTimeoutException(int attempts) {
    super(String.format("Transcription timeout after %d polling attempts", attempts));
    this.attempts = attempts;
  }

  public int getAttempts() {
    return attempts;
  }
}
