package com.atasa.audio.processor.job;

import java.time.Duration;
import java.util.Optional;

/**
 * Registry of jobs keyed by job ID.
 *
 * <p>Writes are whole-record replacements. Each job is written by exactly one background task, so
 * implementations only need to be safe for concurrent access to different keys.
 */
public interface JobRepository {

  /**
   * Register a new job.
   *
   * @throws IllegalStateException if a job with the same ID already exists
   */
  void create(Job job);

  /**
   * Replace the stored record for {@code job.jobId()}.
   *
   * @throws JobNotFoundException if the job was never created or has been swept
   */
  void update(Job job);

  /**
   * Look up a job.
   *
   * @throws JobNotFoundException if the job is unknown or has been swept
   */
  Job get(String jobId);

  Optional<Job> findById(String jobId);

  /**
   * Remove every job created more than {@code maxAge} ago.
   *
   * @return the number of jobs removed
   */
  int sweep(Duration maxAge);
}
