package com.atasa.audio.processor.job;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Builds job IDs of the form {@code <sourceId>-<epochMillis>} and {@code
 * transcribe-<sourceId>-<epochMillis>}.
 *
 * <p>The timestamp part is strictly increasing within the process, so two jobs accepted in the same
 * millisecond still receive distinct IDs. IDs are opaque to the rest of the system; job age comes
 * from {@link Job#createdAt()}.
 */
@Component
public class JobIdGenerator {

  private static final String TRANSCRIPTION_PREFIX = "transcribe-";

  private final Clock clock;
  private final AtomicLong lastStamp = new AtomicLong();

  public JobIdGenerator(Clock clock) {
    this.clock = clock;
  }

  public String extractionJobId(String sourceId) {
    return sourceId + "-" + nextStamp();
  }

  public String transcriptionJobId(String sourceId) {
    return TRANSCRIPTION_PREFIX + sourceId + "-" + nextStamp();
  }

  private long nextStamp() {
    long now = clock.millis();
    return lastStamp.updateAndGet(previous -> Math.max(now, previous + 1));
  }
}
