package com.atasa.audio.processor.transcription;

import com.atasa.audio.processor.logging.StructuredLogger;
import com.atasa.audio.processor.transcription.TranscriptionProperties.AssemblyAiProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Transcription through the AssemblyAI API.
 *
 * <p>Poll style, in three phases:
 *
 * <ol>
 *   <li>Upload the raw audio and receive an {@code upload_url}
 *   <li>Submit a transcript request for that URL and receive a transcript {@code id}
 *   <li>Poll the transcript until it is {@code completed} or {@code error}
 * </ol>
 *
 * <p>Polling sleeps {@code pollInterval} before every check and gives up after {@code
 * maxPollAttempts} checks (5s x 120 = 10 minutes by default).
 */
@Component
public class AssemblyAiTranscriptionProvider implements TranscriptionProvider {

  private static final Logger LOGGER =
      LoggerFactory.getLogger(AssemblyAiTranscriptionProvider.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final int PROGRESS_LOG_EVERY = 6;

  private final HttpClient httpClient;
  private final AssemblyAiProperties properties;
  private final ObjectMapper objectMapper;
  private final Sleeper sleeper;

  public AssemblyAiTranscriptionProvider(
      HttpClient transcriptionHttpClient,
      TranscriptionProperties properties,
      ObjectMapper objectMapper,
      Sleeper sleeper) {
    this.httpClient = transcriptionHttpClient;
    this.properties = properties.assemblyai();
    this.objectMapper = objectMapper;
    this.sleeper = sleeper;

    LOGGER.info(
        "Initialized AssemblyAI provider: baseUrl={}, pollInterval={}, maxPollAttempts={}",
        this.properties.baseUrl(),
        this.properties.pollInterval(),
        this.properties.maxPollAttempts());
  }

  @Override
  public ProviderType type() {
    return ProviderType.ASSEMBLYAI;
  }

  @Override
  public String transcribe(Path audioFile, String language, String apiKey) {
    LOGGER.info(
        "Transcribing with AssemblyAI: file={}, language={}", audioFile.getFileName(), language);

    try {
      String uploadUrl = upload(audioFile, apiKey);
      String transcriptId = submit(uploadUrl, language, apiKey);
      return poll(transcriptId, apiKey);

    } catch (IOException e) {
      throw new TranscriptionException("AssemblyAI request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranscriptionException("AssemblyAI transcription interrupted", e);
    }
  }

  private String upload(Path audioFile, String apiKey) throws IOException, InterruptedException {
    LOGGER.info("Uploading to AssemblyAI: {} bytes", Files.size(audioFile));

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/v2/upload"))
            .timeout(properties.requestTimeout())
            .header("Authorization", apiKey)
            .header("Content-Type", "application/octet-stream")
            .POST(BodyPublishers.ofByteArray(Files.readAllBytes(audioFile)))
            .build();

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    JsonNode body;
    try {
      body = readJson(response.body());
    } catch (JsonProcessingException e) {
      LOGGER.warn("AssemblyAI upload returned a non-JSON body: {}", e.getOriginalMessage());
      throw new UploadFailedException(
          String.format("Upload failed (status %d)", response.statusCode()));
    }
    String uploadUrl = body.path("upload_url").asText("");

    if (uploadUrl.isBlank()) {
      String reason = body.path("error").asText("");
      throw new UploadFailedException(
          reason.isBlank()
              ? String.format("Upload failed (status %d)", response.statusCode())
              : "Upload failed: " + reason);
    }

    LOGGER.info("Upload successful");
    return uploadUrl;
  }

  private String submit(String uploadUrl, String language, String apiKey)
      throws IOException, InterruptedException {
    String payload =
        objectMapper.writeValueAsString(Map.of("audio_url", uploadUrl, "language_code", language));

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/v2/transcript"))
            .timeout(properties.requestTimeout())
            .header("Authorization", apiKey)
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofString(payload))
            .build();

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    JsonNode body = readJson(response.body());

    String error = body.path("error").asText("");
    if (!error.isBlank()) {
      throw new ProviderException(error);
    }

    String transcriptId = body.path("id").asText("");
    if (transcriptId.isBlank()) {
      throw new ProviderException(
          String.format(
              "AssemblyAI returned no transcript id (status %d)", response.statusCode()));
    }

    LOGGER.info("Transcript job submitted: {}", transcriptId);
    return transcriptId;
  }

  private String poll(String transcriptId, String apiKey)
      throws IOException, InterruptedException {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/v2/transcript/" + transcriptId))
            .timeout(properties.requestTimeout())
            .header("Authorization", apiKey)
            .GET()
            .build();

    int maxAttempts = properties.maxPollAttempts();
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      sleeper.sleep(properties.pollInterval());

      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      JsonNode body = readJson(response.body());
      String status = body.path("status").asText("");

      if ("completed".equals(status)) {
        String text = body.path("text").asText("");
        LOGGER.info(
            "AssemblyAI transcription completed ({} chars) after {} polls", text.length(), attempt);
        return text;
      }
      if ("error".equals(status)) {
        String error = body.path("error").asText("");
        throw new ProviderException(error.isBlank() ? "Transcription failed" : error);
      }
      // e.g. 404 for an unknown transcript id: no status, only an error
      String error = body.path("error").asText("");
      if (response.statusCode() / 100 != 2 && !error.isBlank()) {
        throw new ProviderException(error);
      }

      if (attempt % PROGRESS_LOG_EVERY == 0) {
        structuredLogger.logPollProgress(transcriptId, attempt, maxAttempts, status);
      }
    }

    throw new TranscriptionTimeoutException(maxAttempts);
  }

  private JsonNode readJson(String body) throws IOException {
    if (body == null || body.isBlank()) {
      return objectMapper.createObjectNode();
    }
    return objectMapper.readTree(body);
  }
}
