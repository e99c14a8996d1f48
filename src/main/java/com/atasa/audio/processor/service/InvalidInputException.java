package com.atasa.audio.processor.service;

/**
 * A request was rejected before any job was created: a field is missing, malformed or names an
 * unsupported provider.
 */
public class InvalidInputException extends RuntimeException {

  public InvalidInputException(String message) {
    super(message);
  }
}
