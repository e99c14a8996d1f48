package com.atasa.audio.processor.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event sets an {@code event_type} plus its fields in the MDC for the duration of one log
 * call, so log shippers can index them. The job context ({@code jobId}, {@code sourceId}) stays in
 * the MDC for the whole background task.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log job accepted event. */
  public void logJobAccepted(String jobId, String sourceId, String status, String provider) {
    try {
      MDC.put("event_type", "job_accepted");
      MDC.put("status", status);
      if (provider != null) {
        MDC.put("provider", provider);
      }

      logger.info(
          "Job accepted: jobId={}, sourceId={}, status={}, provider={}",
          jobId,
          sourceId,
          status,
          provider);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage started event. */
  public void logStageStarted(String stage) {
    try {
      MDC.put("event_type", "stage_started");
      MDC.put("stage", stage);

      logger.info("Stage started: {}", stage);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage finished event. */
  public void logStageFinished(String stage, long durationMs) {
    try {
      MDC.put("event_type", "stage_finished");
      MDC.put("stage", stage);
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info("Stage finished: {}, took={}ms", stage, durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log job failure event. */
  public void logJobFailed(String jobId, String status, Throwable error) {
    try {
      MDC.put("event_type", "job_failed");
      MDC.put("status", status);
      MDC.put("errorType", error.getClass().getSimpleName());

      logger.error(
          "Job failed: jobId={}, during={}, error={}, message={}",
          jobId,
          status,
          error.getClass().getSimpleName(),
          error.getMessage(),
          error);
    } finally {
      clearEventFields();
    }
  }

  /** Log provider polling progress. */
  public void logPollProgress(String transcriptId, int attempt, int maxAttempts, String status) {
    try {
      MDC.put("event_type", "poll_progress");
      MDC.put("transcriptId", transcriptId);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("status", status);

      logger.info(
          "Polling {}/{}: transcriptId={}, status={}", attempt, maxAttempts, transcriptId, status);
    } finally {
      clearEventFields();
    }
  }

  /** Log retention sweep event. */
  public void logSweep(int artifactsDeleted, int jobsDeleted, long durationMs) {
    try {
      MDC.put("event_type", "retention_sweep");
      MDC.put("artifactsDeleted", String.valueOf(artifactsDeleted));
      MDC.put("jobsDeleted", String.valueOf(jobsDeleted));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Retention sweep: artifactsDeleted={}, jobsDeleted={}, took={}ms",
          artifactsDeleted,
          jobsDeleted,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String sourceId) {
    MDC.put("jobId", jobId);
    MDC.put("sourceId", sourceId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("sourceId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("status");
    MDC.remove("provider");
    MDC.remove("stage");
    MDC.remove("durationMs");
    MDC.remove("errorType");
    MDC.remove("transcriptId");
    MDC.remove("attempt");
    MDC.remove("maxAttempts");
    MDC.remove("artifactsDeleted");
    MDC.remove("jobsDeleted");
  }
}
