package com.atasa.audio.processor.transcription;

import com.atasa.audio.processor.transcription.TranscriptionProperties.OpenAiProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Transcription through the OpenAI Whisper API.
 *
 * <p>Immediate style: one multipart request carries the audio, and the response body is the
 * transcript ({@code response_format=text}). No polling is involved; the request timeout bounds the
 * worst case.
 */
@Component
public class OpenAiTranscriptionProvider implements TranscriptionProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiTranscriptionProvider.class);

  private static final String TRANSCRIPTIONS_PATH = "/v1/audio/transcriptions";

  private final HttpClient httpClient;
  private final OpenAiProperties properties;
  private final ObjectMapper objectMapper;

  public OpenAiTranscriptionProvider(
      HttpClient transcriptionHttpClient,
      TranscriptionProperties properties,
      ObjectMapper objectMapper) {
    this.httpClient = transcriptionHttpClient;
    this.properties = properties.openai();
    this.objectMapper = objectMapper;

    LOGGER.info("Initialized OpenAI provider: baseUrl={}", this.properties.baseUrl());
  }

  @Override
  public ProviderType type() {
    return ProviderType.OPENAI;
  }

  @Override
  public String transcribe(Path audioFile, String language, String apiKey) {
    LOGGER.info("Transcribing with OpenAI: file={}, language={}", audioFile.getFileName(), language);

    String boundary = UUID.randomUUID().toString();
    HttpResponse<String> response;

    try {
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + TRANSCRIPTIONS_PATH))
              .timeout(properties.requestTimeout())
              .header("Authorization", "Bearer " + apiKey)
              .header("Content-Type", "multipart/form-data; boundary=" + boundary)
              .POST(buildMultipartBody(audioFile, language, boundary))
              .build();

      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    } catch (IOException e) {
      throw new TranscriptionException("OpenAI request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranscriptionException("OpenAI transcription interrupted", e);
    }

    if (response.statusCode() / 100 != 2) {
      String message = errorMessage(response.body());
      LOGGER.warn("OpenAI returned status {}: {}", response.statusCode(), message);
      throw new ProviderException(message);
    }

    String transcript = response.body();
    LOGGER.info("OpenAI transcription completed ({} chars)", transcript.length());
    return transcript;
  }

  /**
   * Build the multipart/form-data body.
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="abc12345678.mp3"
   * Content-Type: audio/mpeg
   *
   * [binary data]
   * --boundary
   * Content-Disposition: form-data; name="model"
   *
   * whisper-1
   * ... language, response_format ...
   * --boundary--
   * </pre>
   */
  private BodyPublisher buildMultipartBody(Path audioFile, String language, String boundary)
      throws IOException {

    String filename = audioFile.getFileName().toString();
    byte[] fileBytes = Files.readAllBytes(audioFile);

    StringBuilder sb = new StringBuilder();
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"file\"; filename=\"")
        .append(filename)
        .append("\"\r\n");
    sb.append("Content-Type: audio/mpeg\r\n\r\n");

    byte[] prefix = sb.toString().getBytes(StandardCharsets.UTF_8);

    sb = new StringBuilder();
    sb.append("\r\n");
    appendField(sb, boundary, "model", properties.model());
    appendField(sb, boundary, "language", language);
    appendField(sb, boundary, "response_format", "text");
    sb.append("--").append(boundary).append("--\r\n");

    byte[] suffix = sb.toString().getBytes(StandardCharsets.UTF_8);

    byte[] body = new byte[prefix.length + fileBytes.length + suffix.length];
    System.arraycopy(prefix, 0, body, 0, prefix.length);
    System.arraycopy(fileBytes, 0, body, prefix.length, fileBytes.length);
    System.arraycopy(suffix, 0, body, prefix.length + fileBytes.length, suffix.length);

    return BodyPublishers.ofByteArray(body);
  }

  private static void appendField(StringBuilder sb, String boundary, String name, String value) {
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"").append(name).append("\"\r\n\r\n");
    sb.append(value).append("\r\n");
  }

  /** Prefer {@code error.message} from a JSON error body, else the raw body. */
  private String errorMessage(String body) {
    if (body == null || body.isBlank()) {
      return "OpenAI request failed with an empty response";
    }
    try {
      JsonNode message = objectMapper.readTree(body).path("error").path("message");
      if (message.isTextual() && !message.asText().isBlank()) {
        return message.asText();
      }
    } catch (IOException e) {
      LOGGER.debug("OpenAI error body is not JSON: {}", e.getMessage());
    }
    return body;
  }
}
