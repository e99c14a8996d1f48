package com.atasa.audio.processor.transcription;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ProviderTypeTest {

  @Test
  void lookupIgnoresCaseAndWhitespace() {
    assertThat(ProviderType.fromValue("openai")).contains(ProviderType.OPENAI);
    assertThat(ProviderType.fromValue(" AssemblyAI ")).contains(ProviderType.ASSEMBLYAI);
  }

  @Test
  void unknownOrMissingProviderIsEmpty() {
    assertThat(ProviderType.fromValue("google")).isEmpty();
    assertThat(ProviderType.fromValue("")).isEmpty();
    assertThat(ProviderType.fromValue(null)).isEmpty();
  }
}
