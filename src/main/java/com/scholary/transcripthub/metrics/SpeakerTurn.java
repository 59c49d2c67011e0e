package com.scholary.transcripthub.metrics;

/**
 * One labelled interval of a diarization.
 *
 * @param start start time in seconds
 * @param end end time in seconds
 * @param speaker speaker label
 */
public record SpeakerTurn(double start, double end, String speaker) {

  public double duration() {
    return Math.max(0.0, end - start);
  }
}
