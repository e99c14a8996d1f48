package com.atasa.audio.processor.transcription;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Supported transcription providers, by the name clients use in requests. */
public enum ProviderType {
  OPENAI("openai"),
  ASSEMBLYAI("assemblyai");

  private final String value;

  ProviderType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** Case-insensitive lookup by request name. */
  public static Optional<ProviderType> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(type -> type.value.equals(normalized)).findFirst();
  }
}
