package com.atasa.audio.processor.api;

import com.atasa.audio.processor.job.Job;
import com.atasa.audio.processor.job.JobStatus;
import java.time.Instant;

/**
 * Response for job status query.
 *
 * <p>{@code resultRef} is the audio file path for finished extractions and the transcript for
 * finished transcriptions. {@code error} is only set on failed jobs.
 */
public record JobStatusResponse(
    String jobId,
    String sourceId,
    String provider,
    JobStatus status,
    String resultRef,
    Long fileSize,
    String error,
    Instant createdAt) {

  static JobStatusResponse from(Job job) {
    return new JobStatusResponse(
        job.jobId(),
        job.sourceId(),
        job.provider(),
        job.status(),
        job.resultRef(),
        job.fileSize(),
        job.error(),
        job.createdAt());
  }
}
