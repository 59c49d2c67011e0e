package com.scholary.transcripthub.job;

/**
 * Identity of a unit of transcription work. At most one live job exists per key.
 *
 * @param language requested language, {@code "auto"} for detection
 */
public record DedupKey(String assetId, String provider, String language) {}
