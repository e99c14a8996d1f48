package com.atasa.audio.processor.extraction;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the external audio extraction tool.
 *
 * <p>{@code sourceUrlTemplate} is a format string receiving the source ID. {@code timeout} is a hard
 * wall-clock limit; the process is killed when it is exceeded. {@code maxOutputChars} caps how much
 * of the tool's output is kept for error messages.
 */
@ConfigurationProperties(prefix = "extraction")
@Validated
public record ExtractionProperties(
    @NotBlank String command,
    @NotBlank String sourceUrlTemplate,
    @NotBlank String audioFormat,
    @NotBlank String audioQuality,
    @NotNull Duration timeout,
    @Positive int maxOutputChars) {}
