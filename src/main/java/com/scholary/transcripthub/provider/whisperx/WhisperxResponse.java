package com.scholary.transcripthub.provider.whisperx;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** Response body of the WhisperX server: aligned segments with speaker-assigned words. */
@JsonIgnoreProperties(ignoreUnknown = true)
record WhisperxResponse(List<SegmentBody> segments, String language) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  record SegmentBody(
      Double start, Double end, String text, String speaker, List<WordBody> words) {}

  /** Words that could not be aligned, typically numerals, come back without timings. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record WordBody(String word, Double start, Double end, Double score, String speaker) {}
}
