package com.atasa.audio.processor.job;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.EnumSet;
import org.junit.jupiter.api.Test;

class JobStatusTest {

  @Test
  void extractionPathEndsInTerminalStatus() {
    assertThat(JobStatus.PROCESSING.canTransitionTo(JobStatus.COMPLETED)).isTrue();
    assertThat(JobStatus.PROCESSING.canTransitionTo(JobStatus.FAILED)).isTrue();
    assertThat(JobStatus.PROCESSING.canTransitionTo(JobStatus.TRANSCRIBING)).isFalse();
  }

  @Test
  void transcriptionPathIsExtractingTranscribingThenTerminal() {
    assertThat(JobStatus.EXTRACTING.canTransitionTo(JobStatus.TRANSCRIBING)).isTrue();
    assertThat(JobStatus.EXTRACTING.canTransitionTo(JobStatus.FAILED)).isTrue();
    assertThat(JobStatus.EXTRACTING.canTransitionTo(JobStatus.COMPLETED)).isFalse();

    assertThat(JobStatus.TRANSCRIBING.canTransitionTo(JobStatus.COMPLETED)).isTrue();
    assertThat(JobStatus.TRANSCRIBING.canTransitionTo(JobStatus.FAILED)).isTrue();
    assertThat(JobStatus.TRANSCRIBING.canTransitionTo(JobStatus.EXTRACTING)).isFalse();
  }

  @Test
  void terminalStatusesHaveNoSuccessors() {
    for (JobStatus terminal : EnumSet.of(JobStatus.COMPLETED, JobStatus.FAILED)) {
      assertThat(terminal.isTerminal()).isTrue();
      for (JobStatus next : JobStatus.values()) {
        assertThat(terminal.canTransitionTo(next)).as("%s -> %s", terminal, next).isFalse();
      }
    }
  }

  @Test
  void serializesAsLowercaseName() {
    assertThat(JobStatus.TRANSCRIBING.value()).isEqualTo("transcribing");
    assertThat(JobStatus.FAILED.value()).isEqualTo("failed");
  }
}
