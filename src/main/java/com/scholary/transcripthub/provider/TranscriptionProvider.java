package com.scholary.transcripthub.provider;

import java.nio.file.Path;

/**
 * A speech-to-text backend.
 *
 * <p>Implementations are stateless Spring singletons and may be called concurrently.
 * Implementations never throw for upstream failures; they return {@link
 * ProviderResult#failure}.
 */
public interface TranscriptionProvider {

  /** Registry name, as used in requests and result file names. */
  String name();

  /**
   * Transcribe a local audio file.
   *
   * @param audio audio file, readable for the duration of the call
   * @param language ISO 639-1 code, or {@code "auto"}/{@code null} to let the provider detect it
   */
  ProviderResult transcribe(Path audio, String language);

  /** Whether {@code language} asks for detection rather than a fixed language. */
  static boolean isAutoDetect(String language) {
    return language == null || language.isBlank() || "auto".equalsIgnoreCase(language);
  }
}
