package com.scholary.transcripthub.segment;

import java.util.List;

/**
 * A contiguous, speaker-homogeneous span of transcribed speech.
 *
 * <p>Segments produced by {@link SegmentBuilder} satisfy: {@code words} are content tokens in
 * start order, all sharing {@code speaker}; {@code start} is the first word's start and {@code
 * end} the last word's end. Provider responses use the same record for their raw output, where
 * {@code words} may be empty and may still contain spacing tokens.
 *
 * @param start start time in seconds
 * @param end end time in seconds
 * @param text reconstructed text
 * @param speaker speaker label, may be {@code null}
 * @param words word-level timings, never {@code null}
 */
public record Segment(double start, double end, String text, String speaker, List<Word> words) {

  public Segment {
    text = text == null ? "" : text;
    words = words == null ? List.of() : List.copyOf(words);
  }

  public double duration() {
    return end - start;
  }
}
