package com.scholary.transcripthub.summary;

import java.time.Instant;
import java.util.List;

/** A stored summary of a completed job's transcript. */
public record Summary(
    String jobId, String overview, List<SummaryPoint> points, Instant createdAt) {}
