package com.atasa.audio.processor.api;

import com.atasa.audio.processor.artifact.ArtifactNotFoundException;
import com.atasa.audio.processor.artifact.ArtifactStore;
import com.atasa.audio.processor.extraction.SourceIds;
import com.atasa.audio.processor.job.Job;
import com.atasa.audio.processor.job.JobRepository;
import com.atasa.audio.processor.service.AudioJobOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for audio extraction and transcription.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Starting an audio extraction (returns job ID immediately)
 *   <li>Starting a transcription (returns job ID immediately)
 *   <li>Downloading extracted audio
 *   <li>Job status polling
 * </ul>
 */
@RestController
@Tag(name = "Audio", description = "Audio extraction and transcription API")
public class AudioController {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioController.class);

  static final MediaType AUDIO_MPEG = MediaType.parseMediaType("audio/mpeg");

  private final AudioJobOrchestrator orchestrator;
  private final JobRepository jobRepository;
  private final ArtifactStore artifactStore;

  public AudioController(
      AudioJobOrchestrator orchestrator, JobRepository jobRepository, ArtifactStore artifactStore) {
    this.orchestrator = orchestrator;
    this.jobRepository = jobRepository;
    this.artifactStore = artifactStore;
  }

  @GetMapping("/")
  @Operation(summary = "Service info", description = "Health banner listing the available endpoints")
  public Map<String, Object> info() {
    Map<String, String> endpoints = new LinkedHashMap<>();
    endpoints.put("POST /extract", "Extract audio from YouTube video");
    endpoints.put("POST /transcribe", "Transcribe audio with AssemblyAI or OpenAI");
    endpoints.put("GET /audio/:id", "Get audio file");
    endpoints.put("GET /status/:id", "Check processing status");

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "ok");
    body.put("message", "Atasa Audio Processor");
    body.put("endpoints", endpoints);
    return body;
  }

  @PostMapping("/extract")
  @Operation(
      summary = "Extract audio",
      description = "Start an asynchronous audio extraction and return a job ID for status polling")
  public ResponseEntity<AsyncJobResponse> extract(@RequestBody ExtractRequest request) {
    LOGGER.info(
        "Extract request: videoId={}, youtubeUrl={}", request.videoId(), request.youtubeUrl());

    Job job = orchestrator.requestExtraction(request.sourceIdOrUrl());
    return ResponseEntity.ok(new AsyncJobResponse(true, job.jobId(), job.status()));
  }

  @PostMapping("/transcribe")
  @Operation(
      summary = "Transcribe audio",
      description =
          "Start an asynchronous transcription with OpenAI or AssemblyAI. "
              + "Audio that is not cached yet is extracted first.")
  public ResponseEntity<AsyncJobResponse> transcribe(@RequestBody TranscribeRequest request) {
    LOGGER.info(
        "Transcribe request: videoId={}, provider={}, language={}",
        request.videoId(),
        request.provider(),
        request.language());

    Job job =
        orchestrator.requestTranscription(
            request.videoId(), request.provider(), request.apiKey(), request.language());
    return ResponseEntity.ok(new AsyncJobResponse(true, job.jobId(), job.status()));
  }

  @GetMapping("/audio/{sourceId}")
  @Operation(summary = "Download audio", description = "Stream a previously extracted MP3 file")
  public ResponseEntity<Resource> getAudio(@PathVariable String sourceId) {
    if (!SourceIds.isValid(sourceId) || !artifactStore.exists(sourceId)) {
      throw new ArtifactNotFoundException(sourceId);
    }

    ContentDisposition disposition =
        ContentDisposition.attachment().filename(sourceId + ".mp3").build();

    return ResponseEntity.ok()
        .contentType(AUDIO_MPEG)
        .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
        .body(new FileSystemResource(artifactStore.pathFor(sourceId)));
  }

  @GetMapping("/status/{jobId}")
  @Operation(summary = "Get job status", description = "Check the status of an async job")
  public ResponseEntity<JobStatusResponse> getStatus(@PathVariable String jobId) {
    return ResponseEntity.ok(JobStatusResponse.from(jobRepository.get(jobId)));
  }
}
