package com.atasa.audio.processor.artifact;

/**
 * Exception thrown when the local artifact directory cannot be read or written.
 *
 * <p>Unchecked because the caller can do nothing about a broken scratch directory except fail the
 * job that needed it.
 */
public class ArtifactStoreException extends RuntimeException {

  public ArtifactStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
