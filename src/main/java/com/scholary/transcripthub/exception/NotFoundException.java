package com.scholary.transcripthub.exception;

/** Unknown asset, job or summary. */
public class NotFoundException extends TranscriptHubException {

  public NotFoundException(String message) {
    super(message);
  }

  public static NotFoundException job(String jobId) {
    return new NotFoundException("Job not found: " + jobId);
  }

  public static NotFoundException asset(String description) {
    return new NotFoundException("Asset not found: " + description);
  }
}
