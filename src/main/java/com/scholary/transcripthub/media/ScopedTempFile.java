package com.scholary.transcripthub.media;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A temp file that is deleted when the owning operation's try-with-resources block exits.
 *
 * <p>Used for uploaded audio, assets materialized for a worker, evaluation samples and extracted
 * YouTube audio.
 */
public final class ScopedTempFile implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScopedTempFile.class);

  private final Path path;

  private ScopedTempFile(Path path) {
    this.path = path;
  }

  /** Create an empty temp file in {@code directory}, creating the directory if needed. */
  public static ScopedTempFile create(Path directory, String prefix, String suffix)
      throws IOException {
    Files.createDirectories(directory);
    return new ScopedTempFile(Files.createTempFile(directory, prefix, suffix));
  }

  /** Take ownership of an existing file, such as one written by an external tool. */
  public static ScopedTempFile adopt(Path path) {
    return new ScopedTempFile(path);
  }

  public Path path() {
    return path;
  }

  @Override
  public void close() {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temp file {}", path, e);
    }
  }
}
