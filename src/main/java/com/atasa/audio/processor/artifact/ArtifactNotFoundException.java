package com.atasa.audio.processor.artifact;

/** Thrown when no cached audio exists for a source ID. */
public class ArtifactNotFoundException extends RuntimeException {

  public ArtifactNotFoundException(String sourceId) {
    super("Audio not found: " + sourceId);
  }
}
