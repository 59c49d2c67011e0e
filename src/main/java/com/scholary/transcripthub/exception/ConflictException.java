package com.scholary.transcripthub.exception;

/**
 * A uniqueness collision on create: an asset content key that is already registered in its
 * namespace, or a live job that already holds the dedup key.
 *
 * <p>Carries the identifier of the record that won, so callers can collapse onto it.
 */
public class ConflictException extends TranscriptHubException {

  private final String existingId;

  public ConflictException(String message, String existingId) {
    super(message);
    this.existingId = existingId;
  }

  public String getExistingId() {
    return existingId;
  }
}
