package com.atasa.audio.processor.config;

import com.atasa.audio.processor.transcription.Sleeper;
import com.atasa.audio.processor.transcription.TranscriptionProperties;
import java.net.http.HttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for transcription-related beans.
 *
 * <p>Enables the TranscriptionProperties and provides the HTTP client shared by both providers.
 * Per-request timeouts are set on each request; the client only bounds connection setup.
 */
@Configuration
@EnableConfigurationProperties(TranscriptionProperties.class)
public class TranscriptionConfig {

  @Bean
  public HttpClient transcriptionHttpClient(TranscriptionProperties properties) {
    return HttpClient.newBuilder()
        .connectTimeout(properties.connectTimeout())
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  @Bean
  public Sleeper pollSleeper() {
    return Sleeper.SYSTEM;
  }
}
