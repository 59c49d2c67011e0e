package com.scholary.transcripthub.media;

/**
 * Time-limited link to an asset's stored bytes, for playback next to its transcript.
 *
 * @param url presigned object store URL
 */
public record MediaLink(String assetId, String fileName, String mimeType, String url) {

  public static MediaLink of(Asset asset, String url) {
    return new MediaLink(asset.id(), asset.displayName(), asset.mimeType(), url);
  }
}
