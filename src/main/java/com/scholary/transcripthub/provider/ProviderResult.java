package com.scholary.transcripthub.provider;

import com.scholary.transcripthub.exception.ProviderException;
import java.util.Objects;

/**
 * Outcome of a provider call: either a {@link RecognitionResult} or the {@link ProviderException}
 * describing why there is none.
 */
public final class ProviderResult {

  private final RecognitionResult recognition;
  private final ProviderException error;

  private ProviderResult(RecognitionResult recognition, ProviderException error) {
    this.recognition = recognition;
    this.error = error;
  }

  public static ProviderResult success(RecognitionResult recognition) {
    return new ProviderResult(Objects.requireNonNull(recognition, "recognition"), null);
  }

  public static ProviderResult failure(ProviderException error) {
    return new ProviderResult(null, Objects.requireNonNull(error, "error"));
  }

  public boolean isSuccess() {
    return error == null;
  }

  /**
   * @throws IllegalStateException if this is a failure
   */
  public RecognitionResult recognition() {
    if (error != null) {
      throw new IllegalStateException("Provider call failed", error);
    }
    return recognition;
  }

  /**
   * @throws IllegalStateException if this is a success
   */
  public ProviderException error() {
    if (error == null) {
      throw new IllegalStateException("Provider call succeeded");
    }
    return error;
  }

  /** Unwrap, rethrowing the failure. */
  public RecognitionResult orElseThrow() {
    if (error != null) {
      throw error;
    }
    return recognition;
  }

  @Override
  public String toString() {
    return isSuccess()
        ? "ProviderResult[success, segments=" + recognition.segments().size() + "]"
        : "ProviderResult[failure, " + error.getMessage() + "]";
  }
}
