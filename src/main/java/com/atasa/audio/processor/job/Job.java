package com.atasa.audio.processor.job;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of an asynchronous extraction or transcription job.
 *
 * <p>Every state change produces a new record which replaces the previous one in the {@link
 * JobRepository}. {@code resultRef} holds the audio file path for extraction jobs and the transcript
 * text for transcription jobs.
 */
public record Job(
    String jobId,
    String sourceId,
    String provider,
    JobStatus status,
    String resultRef,
    Long fileSize,
    String error,
    Instant createdAt) {

  public Job {
    Objects.requireNonNull(jobId, "jobId");
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  /** A freshly accepted job with no result yet. */
  public static Job accepted(
      String jobId, String sourceId, String provider, JobStatus status, Instant createdAt) {
    if (status.isTerminal()) {
      throw new IllegalArgumentException("A job cannot start in terminal status " + status.value());
    }
    return new Job(jobId, sourceId, provider, status, null, null, null, createdAt);
  }

  public Job advanceTo(JobStatus next) {
    if (next.isTerminal()) {
      throw new IllegalArgumentException("Use complete() or fail() to finish a job");
    }
    checkTransition(next);
    return new Job(jobId, sourceId, provider, next, null, null, null, createdAt);
  }

  public Job complete(String resultRef, Long fileSize) {
    checkTransition(JobStatus.COMPLETED);
    return new Job(
        jobId, sourceId, provider, JobStatus.COMPLETED, resultRef, fileSize, null, createdAt);
  }

  public Job fail(String error) {
    checkTransition(JobStatus.FAILED);
    return new Job(jobId, sourceId, provider, JobStatus.FAILED, null, null, error, createdAt);
  }

  private void checkTransition(JobStatus next) {
    if (!status.canTransitionTo(next)) {
      throw new IllegalStateException(
          String.format(
              "Job %s cannot move from %s to %s", jobId, status.value(), next.value()));
    }
  }
}
