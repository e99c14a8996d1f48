package com.atasa.audio.processor;

import static org.assertj.core.api.Assertions.assertThat;

import com.atasa.audio.processor.transcription.ProviderType;
import com.atasa.audio.processor.transcription.TranscriptionProviders;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

@SpringBootTest
class AudioProcessorApplicationTests {

  @TempDir static Path artifactDir;

  @DynamicPropertySource
  static void configureProperties(DynamicPropertyRegistry registry) {
    registry.add("artifacts.directory", () -> artifactDir.toString());
  }

  @Autowired private TranscriptionProviders transcriptionProviders;

  @Test
  void contextLoadsWithBothProviders() {
    for (ProviderType type : ProviderType.values()) {
      assertThat(transcriptionProviders.find(type.value())).isPresent();
    }
  }
}
