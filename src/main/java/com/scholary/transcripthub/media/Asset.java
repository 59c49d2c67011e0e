package com.scholary.transcripthub.media;

import java.time.Instant;

/**
 * A stored media item, identified by its content key within a namespace.
 *
 * <p>Immutable once registered.
 */
public record Asset(
    String id,
    String contentKey,
    ContentNamespace namespace,
    String displayName,
    String mimeType,
    String owner,
    Instant createdAt) {

  /** Whether {@code principal} may regenerate or delete work on this asset. */
  public boolean isAccessibleBy(String principal) {
    return owner == null || owner.equals(principal);
  }
}
