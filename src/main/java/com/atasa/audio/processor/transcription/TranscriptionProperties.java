package com.atasa.audio.processor.transcription;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for transcription processing.
 *
 * <p>Controls the default language, the background executor and the two provider endpoints. API keys
 * are not configured here: they arrive with each request.
 */
@ConfigurationProperties(prefix = "transcription")
@Validated
public record TranscriptionProperties(
    @NotBlank String defaultLanguage,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize,
    @NotNull Duration connectTimeout,
    @Valid @NotNull OpenAiProperties openai,
    @Valid @NotNull AssemblyAiProperties assemblyai) {

  public record OpenAiProperties(
      @NotBlank String baseUrl, @NotBlank String model, @NotNull Duration requestTimeout) {}

  public record AssemblyAiProperties(
      @NotBlank String baseUrl,
      @NotNull Duration pollInterval,
      @Positive int maxPollAttempts,
      @NotNull Duration requestTimeout) {}
}
