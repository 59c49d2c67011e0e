package com.scholary.transcripthub.provider.gemini;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcripthub.exception.ProviderException;
import com.scholary.transcripthub.media.MediaTypes;
import com.scholary.transcripthub.provider.ProviderResult;
import com.scholary.transcripthub.provider.RecognitionResult;
import com.scholary.transcripthub.provider.TranscriptionProvider;
import com.scholary.transcripthub.provider.gemini.GeminiClient.UploadedFile;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Transcribes by prompting Gemini with the audio, inline or uploaded, and asking for timestamped
 * JSON.
 */
@Component
public class GeminiProvider implements TranscriptionProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeminiProvider.class);

  static final String SYSTEM_INSTRUCTION =
      "You are a transcription assistant. Transcribe the audio provided to you.\n"
          + "Your response must be a JSON object with the fields 'segments' and 'language'.\n"
          + "'segments' is a list of objects with 'start', 'end', 'text' and 'speaker' fields.\n"
          + "'start' and 'end' use the format MM:SS.mmm with millisecond accuracy.\n"
          + "'speaker' is the speaker's name or 'Speaker X'.\n"
          + "'language' is the 2-letter code of the spoken language.";

  private final GeminiClient client;
  private final GeminiTranscriptParser parser;

  public GeminiProvider(GeminiClient client, ObjectMapper objectMapper) {
    this.client = client;
    this.parser = new GeminiTranscriptParser(objectMapper);
  }

  @Override
  public String name() {
    return GeminiClient.NAME;
  }

  @Override
  public ProviderResult transcribe(Path audio, String language) {
    try {
      long size = Files.size(audio);
      boolean inline = size <= client.properties().maxInlineBytes();
      LOGGER.info(
          "Transcribing with Gemini: file={}, bytes={}, language={}, inline={}",
          audio.getFileName(),
          size,
          language,
          inline);

      String text = inline ? generateInline(audio, language) : generateUploaded(audio, language);
      RecognitionResult result = parser.parse(text);
      LOGGER.info(
          "Gemini transcription successful: {} segments, language={}",
          result.segments().size(),
          result.detectedLanguage());
      return ProviderResult.success(result);
    } catch (ProviderException e) {
      return ProviderResult.failure(e);
    } catch (IOException e) {
      return ProviderResult.failure(
          new ProviderException(GeminiClient.NAME, "Failed to read audio file " + audio, e));
    }
  }

  private String generateInline(Path audio, String language) throws IOException {
    return client.generate(
        SYSTEM_INSTRUCTION, prompt(language), Files.readAllBytes(audio), MediaTypes.forPath(audio));
  }

  private String generateUploaded(Path audio, String language) {
    UploadedFile file = client.uploadFile(audio, MediaTypes.forPath(audio));
    try {
      return client.generate(SYSTEM_INSTRUCTION, prompt(language), file);
    } finally {
      try {
        client.deleteFile(file);
      } catch (ProviderException e) {
        LOGGER.warn("Could not delete Gemini file {}, it expires on its own", file.name(), e);
      }
    }
  }

  static String prompt(String language) {
    String prompt = "Transcribe the following audio file with correct timestamps";
    if (TranscriptionProvider.isAutoDetect(language)) {
      return prompt + ".";
    }
    return prompt + " and translate it to " + language + ".";
  }
}
