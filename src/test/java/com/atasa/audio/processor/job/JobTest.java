package com.atasa.audio.processor.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class JobTest {

  private static final Instant CREATED = Instant.parse("2024-05-01T10:00:00Z");

  @Test
  void acceptedJobHasNoResult() {
    Job job = Job.accepted("j1", "abc12345678", "openai", JobStatus.EXTRACTING, CREATED);

    assertThat(job.status()).isEqualTo(JobStatus.EXTRACTING);
    assertThat(job.resultRef()).isNull();
    assertThat(job.fileSize()).isNull();
    assertThat(job.error()).isNull();
    assertThat(job.createdAt()).isEqualTo(CREATED);
  }

  @Test
  void cannotBeAcceptedInTerminalStatus() {
    assertThatThrownBy(
            () -> Job.accepted("j1", "abc12345678", null, JobStatus.COMPLETED, CREATED))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void completeKeepsIdentityAndSetsResult() {
    Job job = Job.accepted("j1", "abc12345678", null, JobStatus.PROCESSING, CREATED);

    Job completed = job.complete("/tmp/abc12345678.mp3", 1024L);

    assertThat(completed.jobId()).isEqualTo("j1");
    assertThat(completed.createdAt()).isEqualTo(CREATED);
    assertThat(completed.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(completed.resultRef()).isEqualTo("/tmp/abc12345678.mp3");
    assertThat(completed.fileSize()).isEqualTo(1024L);
    assertThat(job.status()).isEqualTo(JobStatus.PROCESSING);
  }

  @Test
  void failSetsErrorOnly() {
    Job failed =
        Job.accepted("j1", "abc12345678", "assemblyai", JobStatus.TRANSCRIBING, CREATED)
            .fail("Upload failed");

    assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
    assertThat(failed.error()).isEqualTo("Upload failed");
    assertThat(failed.resultRef()).isNull();
    assertThat(failed.provider()).isEqualTo("assemblyai");
  }

  @Test
  void extractingJobCannotCompleteWithoutTranscribing() {
    Job job = Job.accepted("j1", "abc12345678", "openai", JobStatus.EXTRACTING, CREATED);

    assertThatThrownBy(() -> job.complete("text", null))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Job j1 cannot move from extracting to completed");
  }

  @Test
  void finishedJobIsImmutable() {
    Job completed =
        Job.accepted("j1", "abc12345678", null, JobStatus.PROCESSING, CREATED).complete("p", 1L);

    assertThatThrownBy(() -> completed.fail("late")).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> completed.complete("again", 2L))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void advanceToRejectsTerminalTargets() {
    Job job = Job.accepted("j1", "abc12345678", "openai", JobStatus.TRANSCRIBING, CREATED);

    assertThatThrownBy(() -> job.advanceTo(JobStatus.COMPLETED))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
