package com.scholary.transcripthub.exception;

/** Malformed caller input, for example an unparsable YouTube URL or an unknown provider name. */
public class ValidationException extends TranscriptHubException {

  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
