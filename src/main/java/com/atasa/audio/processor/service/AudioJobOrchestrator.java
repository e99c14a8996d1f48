package com.atasa.audio.processor.service;

import com.atasa.audio.processor.artifact.ArtifactStore;
import com.atasa.audio.processor.extraction.AudioExtractor;
import com.atasa.audio.processor.extraction.ExtractedAudio;
import com.atasa.audio.processor.extraction.SourceIds;
import com.atasa.audio.processor.job.Job;
import com.atasa.audio.processor.job.JobIdGenerator;
import com.atasa.audio.processor.job.JobNotFoundException;
import com.atasa.audio.processor.job.JobRepository;
import com.atasa.audio.processor.job.JobStatus;
import com.atasa.audio.processor.logging.StructuredLogger;
import com.atasa.audio.processor.transcription.TranscriptionProperties;
import com.atasa.audio.processor.transcription.TranscriptionProvider;
import com.atasa.audio.processor.transcription.TranscriptionProviders;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Accepts extraction and transcription requests and runs them as background jobs.
 *
 * <p>Both entry points validate their input, register a job and return it immediately; all I/O
 * happens in one task per job on the shared executor. Within a task the stages run strictly in
 * order (extraction, then transcription) and every stage change replaces the job record. Any
 * failure after acceptance ends up in the job's {@code error} field, never in the HTTP response.
 *
 * <p>There is no retry and no cancellation. A client that wants another attempt sends a new
 * request.
 */
@Service
public class AudioJobOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioJobOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  // Codes such as "tr", "en_us" or "pt-BR". The value ends up inside a multipart body.
  private static final Pattern LANGUAGE_CODE = Pattern.compile("[A-Za-z_-]{2,10}");

  private static final String STAGE_EXTRACTION = "extraction";
  private static final String STAGE_TRANSCRIPTION = "transcription";

  private final JobRepository jobRepository;
  private final JobIdGenerator jobIdGenerator;
  private final ArtifactStore artifactStore;
  private final AudioExtractor audioExtractor;
  private final TranscriptionProviders transcriptionProviders;
  private final Executor taskExecutor;
  private final Clock clock;
  private final String defaultLanguage;

  public AudioJobOrchestrator(
      JobRepository jobRepository,
      JobIdGenerator jobIdGenerator,
      ArtifactStore artifactStore,
      AudioExtractor audioExtractor,
      TranscriptionProviders transcriptionProviders,
      @Qualifier("taskExecutor") Executor taskExecutor,
      Clock clock,
      TranscriptionProperties transcriptionProperties) {
    this.jobRepository = jobRepository;
    this.jobIdGenerator = jobIdGenerator;
    this.artifactStore = artifactStore;
    this.audioExtractor = audioExtractor;
    this.transcriptionProviders = transcriptionProviders;
    this.taskExecutor = taskExecutor;
    this.clock = clock;
    this.defaultLanguage = transcriptionProperties.defaultLanguage();
  }

  /**
   * Start extracting the audio of a video.
   *
   * <p>Any cached audio for the same source is deleted first so the job never reports a stale file.
   *
   * @param sourceIdOrUrl a bare video ID or a URL containing one
   * @return the accepted job, in {@code processing}
   * @throws InvalidInputException if no video ID can be resolved
   */
  public Job requestExtraction(String sourceIdOrUrl) {
    String sourceId =
        SourceIds.resolve(sourceIdOrUrl)
            .orElseThrow(() -> new InvalidInputException("videoId or youtubeUrl required"));

    Job job =
        Job.accepted(
            jobIdGenerator.extractionJobId(sourceId),
            sourceId,
            null,
            JobStatus.PROCESSING,
            clock.instant());
    jobRepository.create(job);
    structuredLogger.logJobAccepted(job.jobId(), sourceId, job.status().value(), null);

    launch(job, () -> runExtraction(job));
    return job;
  }

  /**
   * Start transcribing the audio of a video, extracting it first if it is not cached.
   *
   * <p>The provider is chosen here, once, and used for the whole job.
   *
   * @param sourceId the video ID
   * @param provider "openai" or "assemblyai"
   * @param apiKey the caller's key for that provider
   * @param language language code, or null/blank for the default
   * @return the accepted job, in {@code extracting} or {@code transcribing}
   * @throws InvalidInputException if a field, language included, is missing or malformed
   */
  public Job requestTranscription(
      String sourceId, String provider, String apiKey, String language) {
    if (sourceId == null || sourceId.isBlank()) {
      throw new InvalidInputException("videoId required");
    }
    if (!SourceIds.isValid(sourceId)) {
      throw new InvalidInputException("Invalid videoId: " + sourceId);
    }
    if (apiKey == null || apiKey.isBlank()) {
      throw new InvalidInputException("apiKey required");
    }
    TranscriptionProvider transcriptionProvider =
        transcriptionProviders
            .find(provider)
            .orElseThrow(
                () -> new InvalidInputException("provider must be assemblyai or openai"));
    String effectiveLanguage =
        language == null || language.isBlank() ? defaultLanguage : language.trim();
    if (!LANGUAGE_CODE.matcher(effectiveLanguage).matches()) {
      throw new InvalidInputException("Invalid language: " + effectiveLanguage);
    }

    JobStatus initialStatus =
        artifactStore.exists(sourceId) ? JobStatus.TRANSCRIBING : JobStatus.EXTRACTING;

    Job job =
        Job.accepted(
            jobIdGenerator.transcriptionJobId(sourceId),
            sourceId,
            transcriptionProvider.type().value(),
            initialStatus,
            clock.instant());
    jobRepository.create(job);
    structuredLogger.logJobAccepted(
        job.jobId(), sourceId, job.status().value(), job.provider());

    launch(job, () -> runTranscription(job, transcriptionProvider, apiKey, effectiveLanguage));
    return job;
  }

  private void launch(Job job, Runnable work) {
    try {
      taskExecutor.execute(
          () -> {
            StructuredLogger.setJobContext(job.jobId(), job.sourceId());
            try {
              work.run();
            } finally {
              StructuredLogger.clearJobContext();
            }
          });
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Executor rejected job {}: {}", job.jobId(), e.getMessage());
      record(job.fail("Server busy, please try again later"));
    }
  }

  private void runExtraction(Job job) {
    try {
      artifactStore.remove(job.sourceId());
      ExtractedAudio audio = extract(job.sourceId());
      record(job.complete(audio.path().toString(), audio.sizeBytes()));
    } catch (Exception e) {
      fail(job, e);
    }
  }

  private void runTranscription(
      Job job, TranscriptionProvider provider, String apiKey, String language) {
    Job current = job;
    try {
      Path audioFile;
      if (current.status() == JobStatus.EXTRACTING) {
        audioFile = extract(current.sourceId()).path();
        current = current.advanceTo(JobStatus.TRANSCRIBING);
        record(current);
      } else {
        audioFile = artifactStore.pathFor(current.sourceId());
      }

      structuredLogger.logStageStarted(STAGE_TRANSCRIPTION);
      long startTime = System.currentTimeMillis();
      String transcript = provider.transcribe(audioFile, language, apiKey);
      structuredLogger.logStageFinished(
          STAGE_TRANSCRIPTION, System.currentTimeMillis() - startTime);

      record(current.complete(transcript, null));
    } catch (Exception e) {
      fail(current, e);
    }
  }

  private ExtractedAudio extract(String sourceId) {
    structuredLogger.logStageStarted(STAGE_EXTRACTION);
    long startTime = System.currentTimeMillis();
    ExtractedAudio audio = audioExtractor.extract(sourceId);
    structuredLogger.logStageFinished(STAGE_EXTRACTION, System.currentTimeMillis() - startTime);
    return audio;
  }

  private void fail(Job job, Exception error) {
    structuredLogger.logJobFailed(job.jobId(), job.status().value(), error);
    String message =
        error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    record(job.fail(message));
  }

  private void record(Job job) {
    try {
      jobRepository.update(job);
    } catch (JobNotFoundException e) {
      LOGGER.warn(
          "Job {} was swept before it finished, dropping {} update",
          job.jobId(),
          job.status().value());
    }
  }
}
