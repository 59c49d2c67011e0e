package com.scholary.transcripthub.summary;

import java.util.List;

/** What a {@link Summarizer} produces: an overview and timestamped key points. */
public record SummaryContent(String overview, List<SummaryPoint> points) {

  public SummaryContent {
    points = points == null ? List.of() : List.copyOf(points);
  }
}
