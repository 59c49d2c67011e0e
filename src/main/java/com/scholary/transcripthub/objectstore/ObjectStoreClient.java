package com.scholary.transcripthub.objectstore;

import java.io.InputStream;
import java.net.URL;
import java.time.Duration;

/**
 * Abstraction over the object storage that holds raw media bytes.
 *
 * <p>Assets are written once on first ingestion, read back by workers that need a local copy,
 * and removed when the last job referencing them is deleted.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object as a stream. The caller closes the stream.
   *
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Store an object from a stream.
   *
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType);

  /**
   * Remove an object. Removing a missing object is not an error.
   *
   * @throws ObjectStoreException if the delete fails
   */
  void deleteObject(String bucket, String key);

  /**
   * Generate a presigned URL for temporary read access, used for media playback links.
   *
   * @throws ObjectStoreException if URL generation fails
   */
  URL presignGet(String bucket, String key, Duration ttl);
}
