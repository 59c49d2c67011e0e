package com.scholary.transcripthub.summary;

/**
 * One key point of a summary.
 *
 * @param timestamp offset in seconds where the point is discussed
 */
public record SummaryPoint(String text, double timestamp) {}
