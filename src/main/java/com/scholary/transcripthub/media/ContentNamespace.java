package com.scholary.transcripthub.media;

/**
 * Identity space of an asset's content key.
 *
 * <p>Keys from different namespaces are never compared: a YouTube id that happens to equal a
 * hash prefix still names a different asset.
 */
public enum ContentNamespace {
  /** SHA-256 hex digest of uploaded bytes. */
  CONTENT_HASH("sha256"),
  /** Identifier issued by a remote source, such as a YouTube video id. */
  EXTERNAL_ID("external");

  private final String storagePrefix;

  ContentNamespace(String storagePrefix) {
    this.storagePrefix = storagePrefix;
  }

  public String storagePrefix() {
    return storagePrefix;
  }
}
