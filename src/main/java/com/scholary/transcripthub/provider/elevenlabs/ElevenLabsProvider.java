package com.scholary.transcripthub.provider.elevenlabs;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcripthub.exception.ProviderException;
import com.scholary.transcripthub.media.MediaTypes;
import com.scholary.transcripthub.provider.MultipartBody;
import com.scholary.transcripthub.provider.ProviderHttpClient;
import com.scholary.transcripthub.provider.ProviderResult;
import com.scholary.transcripthub.provider.RecognitionResult;
import com.scholary.transcripthub.provider.TranscriptionProvider;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Transcribes with the ElevenLabs speech-to-text API, diarization enabled.
 *
 * <p>The API expects ISO 639-3 language codes; common ISO 639-1 codes are mapped, anything else
 * is passed through unchanged.
 */
@Component
public class ElevenLabsProvider implements TranscriptionProvider {

  public static final String NAME = "elevenlabs";

  private static final Logger LOGGER = LoggerFactory.getLogger(ElevenLabsProvider.class);

  private static final Map<String, String> LANGUAGE_CODES =
      Map.of(
          "en", "eng",
          "fr", "fra",
          "de", "deu",
          "es", "spa",
          "it", "ita",
          "vi", "vie",
          "ja", "jpn",
          "zh", "zho",
          "nl", "nld",
          "pt", "por");

  private final ElevenLabsProperties properties;
  private final ProviderHttpClient httpClient;
  private final ElevenLabsResponseParser parser;

  public ElevenLabsProvider(ElevenLabsProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        new ProviderHttpClient(
            NAME,
            Duration.ofSeconds(properties.connectTimeout()),
            Duration.ofSeconds(properties.readTimeout()),
            properties.maxRetries()),
        objectMapper);
  }

  ElevenLabsProvider(
      ElevenLabsProperties properties, ProviderHttpClient httpClient, ObjectMapper objectMapper) {
    this.properties = properties;
    this.httpClient = httpClient;
    this.parser = new ElevenLabsResponseParser(objectMapper);
    LOGGER.info(
        "Initialized ElevenLabs provider: baseUrl={}, model={}",
        properties.baseUrl(),
        properties.modelId());
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public ProviderResult transcribe(Path audio, String language) {
    if (properties.apiKey() == null || properties.apiKey().isBlank()) {
      return ProviderResult.failure(
          new ProviderException(NAME, "ElevenLabs API key is not configured"));
    }
    String languageCode = languageCode(language);
    LOGGER.info(
        "Transcribing with ElevenLabs: file={}, language={}",
        audio.getFileName(),
        languageCode == null ? "auto-detect" : languageCode);

    try {
      MultipartBody body =
          new MultipartBody()
              .addFile("file", audio, MediaTypes.forPath(audio))
              .addField("model_id", properties.modelId())
              .addField("diarize", "true")
              .addField("tag_audio_events", "true");
      if (languageCode != null) {
        body.addField("language_code", languageCode);
      }

      HttpRequest request =
          httpClient
              .request(URI.create(properties.baseUrl() + "/v1/speech-to-text"))
              .header("xi-api-key", properties.apiKey())
              .header("Content-Type", body.contentType())
              .POST(body.build())
              .build();

      RecognitionResult result = parser.parse(httpClient.send(request));
      LOGGER.info(
          "ElevenLabs transcription successful: {} speaker runs, language={}",
          result.segments().size(),
          result.detectedLanguage());
      return ProviderResult.success(result);
    } catch (ProviderException e) {
      return ProviderResult.failure(e);
    } catch (IOException e) {
      return ProviderResult.failure(
          new ProviderException(NAME, "Failed to read audio file " + audio, e));
    }
  }

  static String languageCode(String language) {
    if (TranscriptionProvider.isAutoDetect(language)) {
      return null;
    }
    String normalized = language.toLowerCase(Locale.ROOT);
    return LANGUAGE_CODES.getOrDefault(normalized, normalized);
  }
}
