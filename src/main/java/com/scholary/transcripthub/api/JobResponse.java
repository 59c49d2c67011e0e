package com.scholary.transcripthub.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.transcripthub.job.JobStatus;
import com.scholary.transcripthub.job.TranscriptionJob;
import com.scholary.transcripthub.segment.Segment;
import java.time.Instant;
import java.util.List;

/**
 * State of a transcription job. {@code segments} and {@code detectedLanguage} are present once
 * the job has completed, {@code error} once it has failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
    String jobId,
    JobStatus status,
    String assetId,
    String provider,
    String language,
    List<Segment> segments,
    String detectedLanguage,
    String error,
    Instant createdAt,
    Instant updatedAt) {

  public static JobResponse from(TranscriptionJob job) {
    JobStatus status = job.getStatus();
    return new JobResponse(
        job.getId(),
        status,
        job.getAssetId(),
        job.getProvider(),
        job.getLanguage(),
        status == JobStatus.COMPLETED ? job.getSegments() : null,
        status == JobStatus.COMPLETED ? job.getDetectedLanguage() : null,
        job.getErrorMessage(),
        job.getCreatedAt(),
        job.getUpdatedAt());
  }
}
