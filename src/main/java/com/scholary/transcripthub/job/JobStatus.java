package com.scholary.transcripthub.job;

/** Lifecycle of a transcription job. COMPLETED and FAILED are terminal. */
public enum JobStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
