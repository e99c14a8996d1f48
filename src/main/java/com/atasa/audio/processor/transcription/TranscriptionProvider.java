package com.atasa.audio.processor.transcription;

import java.nio.file.Path;

/**
 * A speech-to-text provider.
 *
 * <p>Implementations hide very different wire protocols (a single synchronous upload versus upload,
 * submit and poll) behind one blocking call. Credentials are supplied per call and never stored.
 */
public interface TranscriptionProvider {

  ProviderType type();

  /**
   * Transcribe a local audio file.
   *
   * @param audioFile the audio file, read fully into memory for upload
   * @param language language code, e.g. "tr"
   * @param apiKey the caller's API key for this provider
   * @return the transcript text
   * @throws TranscriptionException if the provider fails or cannot be reached
   */
  String transcribe(Path audioFile, String language, String apiKey);
}
