package com.scholary.transcripthub.provider;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Builds a {@code multipart/form-data} body for {@link java.net.http.HttpClient}, which has no
 * multipart support of its own.
 *
 * <pre>
 * --boundary
 * Content-Disposition: form-data; name="file"; filename="audio.mp3"
 * Content-Type: audio/mpeg
 *
 * [binary data]
 * --boundary
 * Content-Disposition: form-data; name="language"
 *
 * en
 * --boundary--
 * </pre>
 *
 * <p>The body is buffered, so the resulting publisher can be replayed on retry.
 */
public final class MultipartBody {

  private static final String CRLF = "\r\n";

  private final String boundary = UUID.randomUUID().toString();
  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

  public MultipartBody addField(String name, String value) {
    writeAscii("--" + boundary + CRLF);
    writeAscii("Content-Disposition: form-data; name=\"" + name + "\"" + CRLF + CRLF);
    writeUtf8(value);
    writeAscii(CRLF);
    return this;
  }

  public MultipartBody addFile(String name, Path file, String contentType) throws IOException {
    writeAscii("--" + boundary + CRLF);
    writeUtf8(
        "Content-Disposition: form-data; name=\""
            + name
            + "\"; filename=\""
            + file.getFileName()
            + "\""
            + CRLF);
    writeAscii("Content-Type: " + contentType + CRLF + CRLF);
    buffer.write(Files.readAllBytes(file));
    writeAscii(CRLF);
    return this;
  }

  public String contentType() {
    return "multipart/form-data; boundary=" + boundary;
  }

  public BodyPublisher build() {
    writeAscii("--" + boundary + "--" + CRLF);
    return BodyPublishers.ofByteArray(buffer.toByteArray());
  }

  private void writeAscii(String text) {
    buffer.writeBytes(text.getBytes(StandardCharsets.US_ASCII));
  }

  private void writeUtf8(String text) {
    buffer.writeBytes(text.getBytes(StandardCharsets.UTF_8));
  }
}
