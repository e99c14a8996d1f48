package com.atasa.audio.processor.job;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class JobIdGeneratorTest {

  private static final Instant NOW = Instant.ofEpochMilli(1_714_560_000_000L);

  private final JobIdGenerator generator = new JobIdGenerator(Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void extractionIdIsSourceIdAndTimestamp() {
    assertThat(generator.extractionJobId("abc12345678")).isEqualTo("abc12345678-1714560000000");
  }

  @Test
  void transcriptionIdIsPrefixed() {
    assertThat(generator.transcriptionJobId("abc12345678"))
        .isEqualTo("transcribe-abc12345678-1714560000000");
  }

  @Test
  void idsStayUniqueWithinTheSameMillisecond() {
    Set<String> ids = new HashSet<>();
    for (int i = 0; i < 50; i++) {
      ids.add(generator.extractionJobId("abc12345678"));
    }

    assertThat(ids).hasSize(50);
  }
}
