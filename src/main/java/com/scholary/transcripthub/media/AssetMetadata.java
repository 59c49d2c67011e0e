package com.scholary.transcripthub.media;

/**
 * Descriptive fields supplied when an asset is first registered.
 *
 * @param displayName original file name or video title
 * @param mimeType media type of the stored bytes
 * @param owner principal that submitted the asset, {@code null} for anonymous submissions
 */
public record AssetMetadata(String displayName, String mimeType, String owner) {}
