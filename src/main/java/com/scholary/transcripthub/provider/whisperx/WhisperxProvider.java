package com.scholary.transcripthub.provider.whisperx;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcripthub.exception.ProviderException;
import com.scholary.transcripthub.exception.TranscriptParseException;
import com.scholary.transcripthub.media.MediaTypes;
import com.scholary.transcripthub.provider.MultipartBody;
import com.scholary.transcripthub.provider.ProviderHttpClient;
import com.scholary.transcripthub.provider.ProviderResult;
import com.scholary.transcripthub.provider.RecognitionResult;
import com.scholary.transcripthub.provider.TranscriptionProvider;
import com.scholary.transcripthub.provider.whisperx.WhisperxResponse.SegmentBody;
import com.scholary.transcripthub.provider.whisperx.WhisperxResponse.WordBody;
import com.scholary.transcripthub.segment.Segment;
import com.scholary.transcripthub.segment.Word;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for a WhisperX server: transcription, alignment and diarization happen server side.
 *
 * <p>Models stay loaded in the server process, so this client holds no model state.
 */
@Component
public class WhisperxProvider implements TranscriptionProvider {

  public static final String NAME = "whisperx";

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperxProvider.class);

  private final WhisperxProperties properties;
  private final ProviderHttpClient httpClient;
  private final ObjectMapper objectMapper;

  public WhisperxProvider(WhisperxProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        new ProviderHttpClient(
            NAME,
            Duration.ofSeconds(properties.connectTimeout()),
            Duration.ofSeconds(properties.readTimeout()),
            properties.maxRetries()),
        objectMapper);
  }

  WhisperxProvider(
      WhisperxProperties properties, ProviderHttpClient httpClient, ObjectMapper objectMapper) {
    this.properties = properties;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    LOGGER.info("Initialized WhisperX provider: baseUrl={}", properties.baseUrl());
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public ProviderResult transcribe(Path audio, String language) {
    LOGGER.info("Transcribing with WhisperX: file={}, language={}", audio.getFileName(), language);
    try {
      MultipartBody body =
          new MultipartBody()
              .addFile("file", audio, MediaTypes.forPath(audio))
              .addField("diarize", "true");
      if (!TranscriptionProvider.isAutoDetect(language)) {
        body.addField("language", language);
      }

      HttpRequest request =
          httpClient
              .request(URI.create(properties.baseUrl() + "/transcribe"))
              .header("Content-Type", body.contentType())
              .POST(body.build())
              .build();

      RecognitionResult result = parse(httpClient.send(request));
      LOGGER.info(
          "WhisperX transcription successful: {} segments, language={}",
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

  RecognitionResult parse(String body) {
    WhisperxResponse response;
    try {
      response = objectMapper.readValue(body, WhisperxResponse.class);
    } catch (JsonProcessingException e) {
      throw new TranscriptParseException(
          NAME, "Response is not a WhisperX result: " + e.getOriginalMessage(), e);
    }
    if (response == null || response.segments() == null) {
      throw new TranscriptParseException(NAME, "Response has no 'segments'");
    }

    List<Segment> segments = new ArrayList<>();
    for (SegmentBody raw : response.segments()) {
      if (raw.start() == null || raw.end() == null) {
        throw new TranscriptParseException(NAME, "Segment without timings: " + raw);
      }
      segments.add(
          new Segment(raw.start(), raw.end(), raw.text(), raw.speaker(), toWords(raw)));
    }
    return new RecognitionResult(segments, response.language());
  }

  /** Unaligned words borrow the previous word's end, or the segment start for the first word. */
  private static List<Word> toWords(SegmentBody raw) {
    if (raw.words() == null) {
      return List.of();
    }
    List<Word> words = new ArrayList<>(raw.words().size());
    double cursor = raw.start();
    for (WordBody body : raw.words()) {
      if (body.word() == null || body.word().isBlank()) {
        continue;
      }
      double start = body.start() != null ? body.start() : cursor;
      double end = body.end() != null ? body.end() : start;
      String speaker = body.speaker() != null ? body.speaker() : raw.speaker();
      double confidence = body.score() != null ? body.score() : 0.0;
      words.add(Word.content(start, end, body.word().strip(), speaker, confidence));
      cursor = end;
    }
    return words;
  }
}
