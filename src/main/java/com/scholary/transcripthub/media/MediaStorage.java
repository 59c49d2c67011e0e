package com.scholary.transcripthub.media;

import com.scholary.transcripthub.objectstore.ObjectStoreClient;
import com.scholary.transcripthub.objectstore.ObjectStoreProperties;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Keeps the raw bytes of assets in object storage.
 *
 * <p>Objects live under {@code <mediaPrefix>/<namespace>/<contentKey>}, so the same bytes are
 * stored once however many jobs use them.
 */
@Component
public class MediaStorage {

  private static final Logger LOGGER = LoggerFactory.getLogger(MediaStorage.class);

  private final ObjectStoreClient objectStoreClient;
  private final ObjectStoreProperties properties;
  private final Path tempDir;

  public MediaStorage(
      ObjectStoreClient objectStoreClient,
      ObjectStoreProperties properties,
      @Value("${transcription.tempDir}") String tempDir) {
    this.objectStoreClient = objectStoreClient;
    this.properties = properties;
    this.tempDir = Path.of(tempDir);
  }

  public String objectKey(Asset asset) {
    return objectKey(asset.namespace(), asset.contentKey());
  }

  public String objectKey(ContentNamespace namespace, String contentKey) {
    return String.format(
        "%s/%s/%s", properties.mediaPrefix(), namespace.storagePrefix(), contentKey);
  }

  /**
   * Upload the bytes behind a content key. Keys are content addressed, so storing the same key
   * twice writes the same object.
   */
  public void store(ContentNamespace namespace, String contentKey, String mimeType, Path file)
      throws IOException {
    String key = objectKey(namespace, contentKey);
    try (InputStream in = Files.newInputStream(file)) {
      objectStoreClient.putObject(properties.bucket(), key, in, Files.size(file), mimeType);
    }
    LOGGER.info("Stored media {} at {}", contentKey, key);
  }

  /**
   * Copy an asset's bytes into a fresh temp file. The caller owns the returned file and must
   * close it.
   */
  public ScopedTempFile materialize(Asset asset) throws IOException {
    ScopedTempFile local =
        ScopedTempFile.create(
            tempDir, "asset-" + asset.id() + "-", MediaTypes.suffixFor(asset.mimeType()));
    try (InputStream in =
        objectStoreClient.getObjectStream(properties.bucket(), objectKey(asset))) {
      Files.copy(in, local.path(), StandardCopyOption.REPLACE_EXISTING);
      return local;
    } catch (IOException | RuntimeException e) {
      local.close();
      throw e;
    }
  }

  public void delete(Asset asset) {
    objectStoreClient.deleteObject(properties.bucket(), objectKey(asset));
  }

  public String playbackUrl(Asset asset) {
    return objectStoreClient
        .presignGet(
            properties.bucket(),
            objectKey(asset),
            Duration.ofMinutes(properties.presignTtlMinutes()))
        .toString();
  }

  public Path tempDir() {
    return tempDir;
  }
}
