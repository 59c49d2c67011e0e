package com.scholary.transcripthub.exception;

/**
 * Upstream transcription or summarization failure.
 *
 * <p>Covers network errors, non-2xx responses and missing credentials. The provider name is kept
 * so job error messages and logs can say which upstream failed.
 */
public class ProviderException extends TranscriptHubException {

  private final String provider;

  public ProviderException(String provider, String message) {
    super(message);
    this.provider = provider;
  }

  public ProviderException(String provider, String message, Throwable cause) {
    super(message, cause);
    this.provider = provider;
  }

  public String getProvider() {
    return provider;
  }
}
