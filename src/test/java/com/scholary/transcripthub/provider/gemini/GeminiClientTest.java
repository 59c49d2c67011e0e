package com.scholary.transcripthub.provider.gemini;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcripthub.exception.ProviderException;
import com.scholary.transcripthub.provider.ProviderHttpClient;
import com.scholary.transcripthub.provider.gemini.GeminiClient.UploadedFile;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GeminiClientTest {

  @Mock private ProviderHttpClient httpClient;

  @TempDir Path tempDir;

  private final ObjectMapper objectMapper = new ObjectMapper();

  private HttpServer server;
  private final List<String> calls = new CopyOnWriteArrayList<>();
  private final AtomicInteger fileChecks = new AtomicInteger();
  private final AtomicInteger uploadedBytes = new AtomicInteger();
  private final AtomicReference<String> generateBody = new AtomicReference<>();
  private final AtomicReference<String> uploadCommand = new AtomicReference<>();

  @AfterEach
  void tearDown() {
    if (server != null) {
      server.stop(0);
    }
  }

  @Test
  void generate_shouldCallModelEndpointAndJoinTextParts() {
    when(httpClient.request(any(URI.class)))
        .thenAnswer(invocation -> HttpRequest.newBuilder((URI) invocation.getArgument(0)));
    when(httpClient.send(any(HttpRequest.class)))
        .thenReturn(
            "{\"candidates\": [{\"content\": {\"parts\": [{\"text\": \"{\\\"a\\\":\"},"
                + " {\"text\": \" 1}\"}]}}]}");

    String text = client("key").generate("system", "prompt");

    assertThat(text).isEqualTo("{\"a\": 1}");
    ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(request.capture());
    assertThat(request.getValue().uri().toString())
        .isEqualTo("https://gemini.test/v1beta/models/gemini-2.0-flash:generateContent");
    assertThat(request.getValue().headers().firstValue("x-goog-api-key")).contains("key");
  }

  @Test
  void generate_shouldFailWithoutApiKey() {
    assertThatThrownBy(() -> client(" ").generate("system", "prompt"))
        .isInstanceOf(ProviderException.class)
        .hasMessageContaining("API key");
    verifyNoInteractions(httpClient);
  }

  @Test
  void extractText_shouldFailWhenCandidateHasNoText() {
    assertThatThrownBy(
            () -> client("key").extractText("{\"candidates\": [{\"finishReason\": \"SAFETY\"}]}"))
        .isInstanceOf(ProviderException.class)
        .hasMessageContaining("SAFETY");
  }

  @Test
  void stripCodeFence_shouldUnwrapMarkdownFences() throws Exception {
    assertThat(GeminiClient.stripCodeFence("```json\n{\"x\": 1}\n```")).isEqualTo("{\"x\": 1}");
    assertThat(GeminiClient.stripCodeFence("```\n[]\n```  ")).isEqualTo("[]");
    assertThat(GeminiClient.stripCodeFence("  {\"x\": 1} ")).isEqualTo("{\"x\": 1}");
    JsonNode parsed = objectMapper.readTree(GeminiClient.stripCodeFence("```json\n{}\n```"));
    assertThat(parsed.isObject()).isTrue();
  }

  @Test
  void uploadFile_shouldUploadResumablyAndWaitUntilActive() throws IOException {
    startFilesServer("ACTIVE");
    Path audio = tempDir.resolve("long.mp3");
    Files.write(audio, new byte[300]);
    GeminiClient client = stubbedClient(5);

    UploadedFile file = client.uploadFile(audio, "audio/mpeg");
    String text = client.generate("system", "prompt", file);

    assertThat(file.name()).isEqualTo("files/clip-1");
    assertThat(file.uri()).isEqualTo(baseUrl() + "/v1beta/files/clip-1");
    assertThat(uploadedBytes.get()).isEqualTo(300);
    assertThat(uploadCommand.get()).isEqualTo("upload, finalize");
    assertThat(fileChecks.get()).isEqualTo(2);
    assertThat(text).isEqualTo("{\"segments\": []}");
    JsonNode part = objectMapper.readTree(generateBody.get()).at("/contents/0/parts/0/fileData");
    assertThat(part.path("fileUri").asText()).isEqualTo(file.uri());
    assertThat(part.path("mimeType").asText()).isEqualTo("audio/mpeg");
    assertThat(calls)
        .containsExactly(
            "POST /upload/v1beta/files",
            "POST /upload-session/1",
            "GET /v1beta/files/clip-1",
            "GET /v1beta/files/clip-1",
            "POST /v1beta/models/gemini-2.0-flash:generateContent");
  }

  @Test
  void uploadFile_shouldFailWhenProcessingFails() throws IOException {
    startFilesServer("FAILED");
    Path audio = tempDir.resolve("broken.mp3");
    Files.write(audio, new byte[10]);

    assertThatThrownBy(() -> stubbedClient(5).uploadFile(audio, "audio/mpeg"))
        .isInstanceOf(ProviderException.class)
        .hasMessageContaining("failed to process file files/clip-1");
  }

  @Test
  void uploadFile_shouldGiveUpWhenFileStaysProcessing() throws IOException {
    startFilesServer("PROCESSING");
    Path audio = tempDir.resolve("slow.mp3");
    Files.write(audio, new byte[10]);

    assertThatThrownBy(() -> stubbedClient(3).uploadFile(audio, "audio/mpeg"))
        .isInstanceOf(ProviderException.class)
        .hasMessageContaining("still processing after 3 checks");
    assertThat(fileChecks.get()).isEqualTo(2);
  }

  @Test
  void deleteFile_shouldDeleteByName() throws IOException {
    startFilesServer("ACTIVE");

    UploadedFile file =
        new UploadedFile("files/clip-1", baseUrl() + "/v1beta/files/clip-1", "audio/mpeg");

    stubbedClient(5).deleteFile(file);

    assertThat(calls).containsExactly("DELETE /v1beta/files/clip-1");
  }

  /**
   * Serves the Files API upload handshake. The first state check reports PROCESSING, later ones
   * report {@code settledState}.
   */
  private void startFilesServer(String settledState) throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/",
        exchange -> {
          String method = exchange.getRequestMethod();
          String path = exchange.getRequestURI().getPath();
          byte[] request = exchange.getRequestBody().readAllBytes();
          calls.add(method + " " + path);
          int code = 200;
          String response;
          if (path.equals("/upload/v1beta/files")) {
            exchange.getResponseHeaders().add("x-goog-upload-url", baseUrl() + "/upload-session/1");
            response = "{}";
          } else if (path.equals("/upload-session/1")) {
            uploadedBytes.set(request.length);
            uploadCommand.set(exchange.getRequestHeaders().getFirst("X-Goog-Upload-Command"));
            response = "{\"file\": " + fileJson("PROCESSING") + "}";
          } else if (path.equals("/v1beta/files/clip-1") && method.equals("GET")) {
            boolean first = fileChecks.incrementAndGet() == 1;
            response = fileJson(first ? "PROCESSING" : settledState);
          } else if (path.equals("/v1beta/files/clip-1") && method.equals("DELETE")) {
            response = "{}";
          } else if (path.equals("/v1beta/models/gemini-2.0-flash:generateContent")) {
            generateBody.set(new String(request, StandardCharsets.UTF_8));
            response =
                "{\"candidates\": [{\"content\": {\"parts\":"
                    + " [{\"text\": \"{\\\"segments\\\": []}\"}]}}]}";
          } else {
            code = 404;
            response = "not found";
          }
          byte[] body = response.getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(code, body.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
          }
        });
    server.start();
  }

  private String fileJson(String state) {
    return String.format(
        "{\"name\": \"files/clip-1\", \"uri\": \"%s/v1beta/files/clip-1\","
            + " \"mimeType\": \"audio/mpeg\", \"state\": \"%s\"}",
        baseUrl(), state);
  }

  private String baseUrl() {
    return "http://127.0.0.1:" + server.getAddress().getPort();
  }

  private GeminiClient stubbedClient(int pollAttempts) {
    return new GeminiClient(
        new GeminiProperties(baseUrl(), "key", "gemini-2.0-flash", 5, 30, 1, 1024, 1, pollAttempts),
        new ProviderHttpClient(
            GeminiClient.NAME, Duration.ofSeconds(5), Duration.ofSeconds(5), 1, Duration.ZERO),
        objectMapper);
  }

  private GeminiClient client(String apiKey) {
    return new GeminiClient(
        new GeminiProperties(
            "https://gemini.test", apiKey, "gemini-2.0-flash", 5, 30, 1, 1024, 1000, 3),
        httpClient,
        objectMapper);
  }
}
