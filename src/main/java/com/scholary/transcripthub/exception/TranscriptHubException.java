package com.scholary.transcripthub.exception;

/**
 * Base type for every domain failure raised by the transcription pipeline and the evaluation
 * harness.
 *
 * <p>Unchecked, like the storage and provider exceptions it generalizes. The REST boundary maps
 * each subtype to a status code in {@code ApiExceptionHandler}.
 */
public class TranscriptHubException extends RuntimeException {

  public TranscriptHubException(String message) {
    super(message);
  }

  public TranscriptHubException(String message, Throwable cause) {
    super(message, cause);
  }
}
