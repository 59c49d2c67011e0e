package com.scholary.transcripthub.api;

import com.scholary.transcripthub.job.JobListing;
import com.scholary.transcripthub.job.JobStatus;
import com.scholary.transcripthub.job.TranscriptionJob;
import java.time.Instant;

/** One row of a user's job history. */
public record JobListItem(
    String jobId,
    String assetId,
    String fileName,
    String mimeType,
    Instant createdAt,
    String provider,
    String language,
    JobStatus status,
    boolean hasSummary) {

  public static JobListItem from(JobListing listing) {
    TranscriptionJob job = listing.job();
    return new JobListItem(
        job.getId(),
        listing.asset().id(),
        listing.asset().displayName(),
        listing.asset().mimeType(),
        job.getCreatedAt(),
        job.getProvider(),
        job.getLanguage(),
        job.getStatus(),
        listing.hasSummary());
  }
}
