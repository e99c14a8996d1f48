package com.atasa.audio.processor.config;

import com.atasa.audio.processor.artifact.ArtifactProperties;
import com.atasa.audio.processor.artifact.ArtifactStore;
import com.atasa.audio.processor.artifact.LocalArtifactStore;
import java.nio.file.Paths;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the audio artifact cache.
 *
 * <p>Wires the ArtifactStore bean from the "artifacts.*" properties in application.yml.
 */
@Configuration
@EnableConfigurationProperties(ArtifactProperties.class)
public class ArtifactConfig {

  @Bean
  public ArtifactStore artifactStore(ArtifactProperties properties, Clock clock) {
    return new LocalArtifactStore(Paths.get(properties.directory()), clock);
  }
}
