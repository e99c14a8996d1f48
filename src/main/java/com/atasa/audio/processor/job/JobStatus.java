package com.atasa.audio.processor.job;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a job.
 *
 * <p>Extraction jobs move {@code processing -> completed|failed}. Transcription jobs move {@code
 * extracting -> transcribing -> completed|failed}, or start directly in {@code transcribing} when the
 * audio is already cached. Nothing ever moves backward and terminal states have no successors.
 */
public enum JobStatus {
  PROCESSING("processing"),
  EXTRACTING("extracting"),
  TRANSCRIBING("transcribing"),
  COMPLETED("completed"),
  FAILED("failed");

  private final String value;

  JobStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  public boolean canTransitionTo(JobStatus next) {
    return successors().contains(next);
  }

  private Set<JobStatus> successors() {
    switch (this) {
      case PROCESSING:
        return EnumSet.of(COMPLETED, FAILED);
      case EXTRACTING:
        return EnumSet.of(TRANSCRIBING, FAILED);
      case TRANSCRIBING:
        return EnumSet.of(COMPLETED, FAILED);
      default:
        return EnumSet.noneOf(JobStatus.class);
    }
  }
}
