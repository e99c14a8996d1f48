package com.atasa.audio.processor.service;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the retention sweep.
 *
 * <p>{@code maxAge} applies to both cached audio files (by modification time) and job records (by
 * creation time). {@code sweepInterval} is an ISO-8601 duration such as {@code PT1H}.
 */
@ConfigurationProperties(prefix = "retention")
@Validated
public record RetentionProperties(@NotNull Duration maxAge, @NotNull Duration sweepInterval) {}
