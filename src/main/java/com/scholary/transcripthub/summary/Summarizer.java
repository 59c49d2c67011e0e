package com.scholary.transcripthub.summary;

import com.scholary.transcripthub.segment.Segment;
import java.util.List;

/** Produces a summary of a transcript. */
public interface Summarizer {

  /**
   * @throws com.scholary.transcripthub.exception.ProviderException if the backend fails or
   *     returns an unusable summary
   */
  SummaryContent summarize(List<Segment> segments);
}
