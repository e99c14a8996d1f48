package com.atasa.audio.processor.api;

import com.atasa.audio.processor.job.JobStatus;

/**
 * Response for an accepted extraction or transcription request.
 *
 * <p>Returns the job ID to poll at {@code /status/{jobId}} and the status the job started in.
 */
public record AsyncJobResponse(boolean success, String jobId, JobStatus status) {}
