package com.scholary.transcripthub.exception;

/**
 * Provider output that cannot be converted into {@code Word}/{@code Segment} records.
 *
 * <p>Never retried: the same input would produce the same malformed output.
 */
public class TranscriptParseException extends ProviderException {

  public TranscriptParseException(String provider, String message) {
    super(provider, message);
  }

  public TranscriptParseException(String provider, String message, Throwable cause) {
    super(provider, message, cause);
  }
}
