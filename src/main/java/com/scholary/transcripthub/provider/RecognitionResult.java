package com.scholary.transcripthub.provider;

import com.scholary.transcripthub.segment.Segment;
import java.util.List;

/**
 * Raw recognizer output, before re-segmentation.
 *
 * @param segments provider segments in time order; their word lists may include spacing tokens
 * @param detectedLanguage language reported by the provider, {@code null} if it reports none
 */
public record RecognitionResult(List<Segment> segments, String detectedLanguage) {

  public RecognitionResult {
    segments = segments == null ? List.of() : List.copyOf(segments);
  }
}
