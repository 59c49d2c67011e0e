package com.scholary.transcripthub.provider.gemini;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.transcripthub.exception.ProviderException;
import com.scholary.transcripthub.exception.TranscriptParseException;
import com.scholary.transcripthub.provider.ProviderHttpClient;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Minimal client for the Gemini {@code generateContent} and Files REST endpoints.
 *
 * <p>Requests JSON output and returns the concatenated text parts of the first candidate. Media
 * too large to inline is uploaded with the resumable Files protocol and referenced by URI.
 */
@Component
public class GeminiClient {

  public static final String NAME = "google";

  private static final Logger LOGGER = LoggerFactory.getLogger(GeminiClient.class);

  static final String STATE_PROCESSING = "PROCESSING";
  static final String STATE_ACTIVE = "ACTIVE";
  static final String STATE_FAILED = "FAILED";

  /** A file held by the Files API, referenced from prompts by {@code uri}. */
  public record UploadedFile(String name, String uri, String mimeType) {}

  private final GeminiProperties properties;
  private final ProviderHttpClient httpClient;
  private final ObjectMapper objectMapper;

  public GeminiClient(GeminiProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        new ProviderHttpClient(
            NAME,
            Duration.ofSeconds(properties.connectTimeout()),
            Duration.ofSeconds(properties.readTimeout()),
            properties.maxRetries()),
        objectMapper);
  }

  GeminiClient(
      GeminiProperties properties, ProviderHttpClient httpClient, ObjectMapper objectMapper) {
    this.properties = properties;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    LOGGER.info(
        "Initialized Gemini client: baseUrl={}, model={}",
        properties.baseUrl(),
        properties.model());
  }

  public GeminiProperties properties() {
    return properties;
  }

  /** Generate from a text prompt. */
  public String generate(String systemInstruction, String prompt) {
    return generate(systemInstruction, prompt, null, null);
  }

  /**
   * Generate from a prompt plus inline binary content.
   *
   * @param inlineData bytes sent base64 encoded in the request, may be {@code null}
   * @param mimeType media type of {@code inlineData}
   * @throws ProviderException if the call fails or the response carries no text
   */
  public String generate(
      String systemInstruction, String prompt, byte[] inlineData, String mimeType) {
    ObjectNode media = null;
    if (inlineData != null) {
      media = objectMapper.createObjectNode();
      media
          .putObject("inlineData")
          .put("mimeType", mimeType)
          .put("data", Base64.getEncoder().encodeToString(inlineData));
    }
    return generateContent(systemInstruction, prompt, media);
  }

  /** Generate from a prompt plus a file previously uploaded with {@link #uploadFile}. */
  public String generate(String systemInstruction, String prompt, UploadedFile file) {
    ObjectNode media = objectMapper.createObjectNode();
    media.putObject("fileData").put("mimeType", file.mimeType()).put("fileUri", file.uri());
    return generateContent(systemInstruction, prompt, media);
  }

  /**
   * Upload {@code file} through the resumable Files protocol and wait until Gemini has finished
   * processing it.
   *
   * @throws ProviderException if the upload fails, processing fails, or processing does not finish
   *     within {@code filePollMaxAttempts} checks
   */
  public UploadedFile uploadFile(Path file, String mimeType) {
    requireApiKey();
    long size;
    try {
      size = Files.size(file);
    } catch (IOException e) {
      throw new ProviderException(NAME, "Failed to read upload " + file, e);
    }
    ObjectNode metadata = objectMapper.createObjectNode();
    metadata.putObject("file").put("display_name", file.getFileName().toString());

    HttpRequest start =
        httpClient
            .request(URI.create(properties.baseUrl() + "/upload/v1beta/files"))
            .header("x-goog-api-key", properties.apiKey())
            .header("X-Goog-Upload-Protocol", "resumable")
            .header("X-Goog-Upload-Command", "start")
            .header("X-Goog-Upload-Header-Content-Length", Long.toString(size))
            .header("X-Goog-Upload-Header-Content-Type", mimeType)
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofString(encode(metadata)))
            .build();
    HttpResponse<String> started = httpClient.exchange(start);
    String uploadUrl =
        started
            .headers()
            .firstValue("x-goog-upload-url")
            .orElseThrow(
                () -> new ProviderException(NAME, "Gemini upload start returned no upload URL"));

    HttpRequest upload;
    try {
      upload =
          httpClient
              .request(URI.create(uploadUrl))
              .header("X-Goog-Upload-Offset", "0")
              .header("X-Goog-Upload-Command", "upload, finalize")
              .POST(BodyPublishers.ofFile(file))
              .build();
    } catch (FileNotFoundException e) {
      throw new ProviderException(NAME, "Upload source disappeared: " + file, e);
    }
    JsonNode uploaded = readFile(httpClient.send(upload));
    LOGGER.info(
        "Uploaded file to Gemini: name={}, bytes={}, state={}",
        uploaded.path("name").asText(),
        size,
        uploaded.path("state").asText());
    return awaitActive(uploaded, mimeType);
  }

  /** Remove an uploaded file. Files not deleted expire on the Gemini side. */
  public void deleteFile(UploadedFile file) {
    requireApiKey();
    HttpRequest request =
        httpClient
            .request(fileUri(file.name()))
            .header("x-goog-api-key", properties.apiKey())
            .DELETE()
            .build();
    httpClient.send(request);
    LOGGER.debug("Deleted Gemini file {}", file.name());
  }

  private UploadedFile awaitActive(JsonNode file, String mimeType) {
    String name = file.path("name").asText("");
    if (name.isEmpty()) {
      throw new ProviderException(NAME, "Gemini upload response carries no file name");
    }
    JsonNode current = file;
    for (int attempt = 1; ; attempt++) {
      String state = current.path("state").asText(STATE_ACTIVE);
      if (STATE_FAILED.equals(state)) {
        throw new ProviderException(NAME, "Gemini failed to process file " + name);
      }
      if (!STATE_PROCESSING.equals(state)) {
        return new UploadedFile(
            name, current.path("uri").asText(), current.path("mimeType").asText(mimeType));
      }
      if (attempt >= properties.filePollMaxAttempts()) {
        throw new ProviderException(
            NAME,
            String.format("Gemini file %s still processing after %d checks", name, attempt));
      }
      LOGGER.debug("Gemini file {} still processing, check {}", name, attempt);
      sleep(properties.filePollIntervalMillis());
      HttpRequest poll =
          httpClient
              .request(fileUri(name))
              .header("x-goog-api-key", properties.apiKey())
              .GET()
              .build();
      current = readFile(httpClient.send(poll));
    }
  }

  private JsonNode readFile(String responseBody) {
    JsonNode root;
    try {
      root = objectMapper.readTree(responseBody);
    } catch (JsonProcessingException e) {
      throw new TranscriptParseException(NAME, "Gemini file response is not valid JSON", e);
    }
    return root.has("file") ? root.get("file") : root;
  }

  private URI fileUri(String name) {
    return URI.create(String.format("%s/v1beta/%s", properties.baseUrl(), name));
  }

  private String generateContent(String systemInstruction, String prompt, ObjectNode media) {
    requireApiKey();

    ObjectNode body = objectMapper.createObjectNode();
    body.putObject("systemInstruction")
        .putArray("parts")
        .addObject()
        .put("text", systemInstruction);
    ArrayNode parts = body.putArray("contents").addObject().put("role", "user").putArray("parts");
    if (media != null) {
      parts.add(media);
    }
    parts.addObject().put("text", prompt);
    body.putObject("generationConfig").put("responseMimeType", "application/json");

    HttpRequest request =
        httpClient
            .request(
                URI.create(
                    String.format(
                        "%s/v1beta/models/%s:generateContent",
                        properties.baseUrl(), properties.model())))
            .header("x-goog-api-key", properties.apiKey())
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofString(encode(body)))
            .build();

    return extractText(httpClient.send(request));
  }

  private void requireApiKey() {
    if (properties.apiKey() == null || properties.apiKey().isBlank()) {
      throw new ProviderException(NAME, "Gemini API key is not configured");
    }
  }

  private String encode(JsonNode node) {
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new ProviderException(NAME, "Failed to encode Gemini request", e);
    }
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProviderException(NAME, "Interrupted while waiting for Gemini file processing", e);
    }
  }

  String extractText(String responseBody) {
    JsonNode root;
    try {
      root = objectMapper.readTree(responseBody);
    } catch (JsonProcessingException e) {
      throw new TranscriptParseException(NAME, "Gemini response is not valid JSON", e);
    }
    JsonNode parts = root.path("candidates").path(0).path("content").path("parts");
    StringBuilder text = new StringBuilder();
    for (JsonNode part : parts) {
      text.append(part.path("text").asText(""));
    }
    if (text.length() == 0) {
      String reason = root.path("candidates").path(0).path("finishReason").asText("none");
      throw new ProviderException(NAME, "Gemini returned no text, finishReason=" + reason);
    }
    return text.toString();
  }

  /** Remove a surrounding Markdown code fence, if the model added one. */
  public static String stripCodeFence(String text) {
    String trimmed = text.strip();
    if (!trimmed.startsWith("```")) {
      return trimmed;
    }
    int firstNewline = trimmed.indexOf('\n');
    int closing = trimmed.lastIndexOf("```");
    if (firstNewline < 0 || closing <= firstNewline) {
      return trimmed;
    }
    return trimmed.substring(firstNewline + 1, closing).strip();
  }
}
