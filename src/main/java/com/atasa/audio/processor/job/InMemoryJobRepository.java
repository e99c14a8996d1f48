package com.atasa.audio.processor.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory job registry backed by a Caffeine cache.
 *
 * <p>The cache is size-bounded so a flood of requests cannot exhaust memory. Age-based removal is
 * explicit through {@link #sweep(Duration)} rather than Caffeine's own expiry, so that a job is
 * never dropped while its background task may still write to it. Nothing survives a restart.
 */
@Repository
public class InMemoryJobRepository implements JobRepository {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryJobRepository.class);

  private final Cache<String, Job> cache;
  private final Clock clock;

  public InMemoryJobRepository(@Value("${jobstore.maxSize}") int maxSize, Clock clock) {
    this.cache = Caffeine.newBuilder().maximumSize(maxSize).build();
    this.clock = clock;
  }

  @Override
  public void create(Job job) {
    Job existing = cache.asMap().putIfAbsent(job.jobId(), job);
    if (existing != null) {
      throw new IllegalStateException("Job already exists: " + job.jobId());
    }
  }

  @Override
  public void update(Job job) {
    if (cache.asMap().replace(job.jobId(), job) == null) {
      throw new JobNotFoundException(job.jobId());
    }
  }

  @Override
  public Job get(String jobId) {
    return findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  @Override
  public Optional<Job> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  @Override
  public int sweep(Duration maxAge) {
    Instant cutoff = clock.instant().minus(maxAge);
    ConcurrentMap<String, Job> jobs = cache.asMap();

    int removed = 0;
    for (Job job : jobs.values()) {
      if (job.createdAt().isBefore(cutoff) && jobs.remove(job.jobId(), job)) {
        removed++;
      }
    }

    LOGGER.debug("Swept {} jobs created before {}", removed, cutoff);
    return removed;
  }
}
