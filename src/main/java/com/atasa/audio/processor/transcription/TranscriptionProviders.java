package com.atasa.audio.processor.transcription;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Looks up the {@link TranscriptionProvider} for a provider name given in a request. */
@Component
public class TranscriptionProviders {

  private final Map<ProviderType, TranscriptionProvider> providers =
      new EnumMap<>(ProviderType.class);

  public TranscriptionProviders(List<TranscriptionProvider> providers) {
    for (TranscriptionProvider provider : providers) {
      if (this.providers.put(provider.type(), provider) != null) {
        throw new IllegalStateException("Duplicate transcription provider: " + provider.type());
      }
    }
  }

  public Optional<TranscriptionProvider> find(String providerName) {
    return ProviderType.fromValue(providerName).map(providers::get);
  }
}
