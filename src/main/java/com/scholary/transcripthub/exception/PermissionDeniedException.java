package com.scholary.transcripthub.exception;

/** The requesting principal does not own the asset behind a job it tried to change. */
public class PermissionDeniedException extends TranscriptHubException {

  public PermissionDeniedException(String message) {
    super(message);
  }
}
