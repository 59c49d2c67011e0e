package com.scholary.transcripthub.job;

import com.scholary.transcripthub.segment.Segment;
import java.time.Instant;
import java.util.List;

/**
 * One transcription of an asset by a provider in a language.
 *
 * <p>Transitions go through {@link JobRepository#update}, which serializes them per job. Readers
 * may observe a job concurrently; result fields are written before the status that publishes
 * them. Once terminal a job never changes again.
 */
public class TranscriptionJob {

  private final String id;
  private final String assetId;
  private final String provider;
  private final String language;
  private final Instant createdAt;

  private volatile JobStatus status;
  private volatile List<Segment> segments;
  private volatile String detectedLanguage;
  private volatile String errorMessage;
  private volatile Instant updatedAt;

  public TranscriptionJob(
      String id, String assetId, String provider, String language, Instant createdAt) {
    this.id = id;
    this.assetId = assetId;
    this.provider = provider;
    this.language = language;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
    this.status = JobStatus.PENDING;
  }

  /** PENDING to PROCESSING, when a worker claims the job. */
  void markProcessing(Instant now) {
    requireStatus(JobStatus.PENDING, "start");
    this.updatedAt = now;
    this.status = JobStatus.PROCESSING;
  }

  /** PROCESSING to COMPLETED. */
  void complete(List<Segment> segments, String detectedLanguage, Instant now) {
    requireStatus(JobStatus.PROCESSING, "complete");
    this.segments = List.copyOf(segments);
    this.detectedLanguage = detectedLanguage;
    this.updatedAt = now;
    this.status = JobStatus.COMPLETED;
  }

  /** Any live state to FAILED. A job that could not be queued fails from PENDING. */
  void fail(String errorMessage, Instant now) {
    if (status.isTerminal()) {
      throw new IllegalStateException(
          String.format("Cannot fail job %s: already %s", id, status));
    }
    this.errorMessage = errorMessage;
    this.updatedAt = now;
    this.status = JobStatus.FAILED;
  }

  private void requireStatus(JobStatus expected, String action) {
    if (status != expected) {
      throw new IllegalStateException(
          String.format(
              "Cannot %s job %s: status is %s, expected %s", action, id, status, expected));
    }
  }

  public DedupKey dedupKey() {
    return new DedupKey(assetId, provider, language);
  }

  public String getId() {
    return id;
  }

  public String getAssetId() {
    return assetId;
  }

  public String getProvider() {
    return provider;
  }

  public String getLanguage() {
    return language;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public JobStatus getStatus() {
    return status;
  }

  /** Segments of a completed job, {@code null} otherwise. */
  public List<Segment> getSegments() {
    return segments;
  }

  public String getDetectedLanguage() {
    return detectedLanguage;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  @Override
  public String toString() {
    return String.format(
        "TranscriptionJob[id=%s, assetId=%s, provider=%s, language=%s, status=%s]",
        id, assetId, provider, language, status);
  }
}
