package com.atasa.audio.processor.service;

import com.atasa.audio.processor.artifact.ArtifactStore;
import com.atasa.audio.processor.job.JobRepository;
import com.atasa.audio.processor.logging.StructuredLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically deletes expired audio files and job records.
 *
 * <p>Runs independently of job tasks. The two sweeps are isolated from each other: if the artifact
 * sweep fails, the job sweep still runs, and vice versa.
 */
@Component
public class RetentionSweeper {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetentionSweeper.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final ArtifactStore artifactStore;
  private final JobRepository jobRepository;
  private final RetentionProperties properties;

  public RetentionSweeper(
      ArtifactStore artifactStore, JobRepository jobRepository, RetentionProperties properties) {
    this.artifactStore = artifactStore;
    this.jobRepository = jobRepository;
    this.properties = properties;
  }

  @Scheduled(
      fixedRateString = "${retention.sweepInterval}",
      initialDelayString = "${retention.sweepInterval}")
  public void sweep() {
    long startTime = System.currentTimeMillis();

    int artifactsDeleted = 0;
    try {
      artifactsDeleted = artifactStore.sweep(properties.maxAge());
    } catch (RuntimeException e) {
      LOGGER.error("Artifact sweep failed", e);
    }

    int jobsDeleted = 0;
    try {
      jobsDeleted = jobRepository.sweep(properties.maxAge());
    } catch (RuntimeException e) {
      LOGGER.error("Job sweep failed", e);
    }

    structuredLogger.logSweep(
        artifactsDeleted, jobsDeleted, System.currentTimeMillis() - startTime);
  }
}
