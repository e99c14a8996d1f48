package com.atasa.audio.processor.job;

/**
 * Thrown when a job ID is unknown, either because it never existed or because the retention sweep
 * already removed it. Callers should treat this as "unknown job", never as a transient failure.
 */
public class JobNotFoundException extends RuntimeException {

  private final String jobId;

  public JobNotFoundException(String jobId) {
    super("Job not found: " + jobId);
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }
}
