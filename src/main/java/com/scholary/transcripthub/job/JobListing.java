package com.scholary.transcripthub.job;

import com.scholary.transcripthub.media.Asset;

/** A job as shown in a user's history, with the asset it transcribes. */
public record JobListing(TranscriptionJob job, Asset asset, boolean hasSummary) {}
