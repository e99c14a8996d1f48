package com.atasa.audio.processor.transcription;

/** The audio upload did not yield a reference to the uploaded file. */
public class UploadFailedException extends TranscriptionException {

  public UploadFailedException(String message) {
    super(message);
  }
}
