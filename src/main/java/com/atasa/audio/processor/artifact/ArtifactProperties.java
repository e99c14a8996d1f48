package com.atasa.audio.processor.artifact;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the local audio cache.
 *
 * <p>Maps to the "artifacts.*" keys in application.yml.
 */
@ConfigurationProperties(prefix = "artifacts")
@Validated
public record ArtifactProperties(@NotBlank String directory) {}
