package com.atasa.audio.processor.api;

import com.atasa.audio.processor.artifact.ArtifactNotFoundException;
import com.atasa.audio.processor.job.JobNotFoundException;
import com.atasa.audio.processor.service.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps request-time failures to {@code {"error": ...}} responses.
 *
 * <p>Only validation and lookup errors reach this handler. Failures inside a running job are
 * recorded on the job instead.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidInputException.class)
  public ResponseEntity<ErrorResponse> handleInvalidInput(InvalidInputException exception) {
    return build(HttpStatus.BAD_REQUEST, exception.getMessage());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException exception) {
    return build(HttpStatus.BAD_REQUEST, "Malformed JSON request");
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleJobNotFound(JobNotFoundException exception) {
    return build(HttpStatus.NOT_FOUND, "Job not found");
  }

  @ExceptionHandler(ArtifactNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleAudioNotFound(ArtifactNotFoundException exception) {
    return build(HttpStatus.NOT_FOUND, "Audio not found");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnknown(Exception exception) {
    LOGGER.error("Unhandled request failure", exception);
    return build(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error");
  }

  private ResponseEntity<ErrorResponse> build(HttpStatus status, String message) {
    return ResponseEntity.status(status).body(new ErrorResponse(message));
  }
}
