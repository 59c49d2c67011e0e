package com.scholary.transcripthub.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Merges a diarized word stream into speaker-turn segments under a length budget.
 *
 * <p>Strategy:
 *
 * <ul>
 *   <li>Words are collected into sentences. A sentence closes on a token ending with {@code .},
 *       {@code ?} or {@code !}, or on the last token of the stream.
 *   <li>Closed sentences accumulate in the segment in progress while the merged text stays within
 *       {@code maxSegmentLength}. Once it would overflow, the segment is emitted and the sentence
 *       starts the next one.
 *   <li>A single sentence longer than the budget is emitted on its own.
 *   <li>A speaker change always ends the segment in progress. The sentence it cuts short is
 *       closed and budgeted like any other, so it can end up as a segment of its own.
 * </ul>
 *
 * <p>Spacing tokens are appended to an open sentence's text and dropped otherwise. Sentences that
 * meet inside one segment are separated by a single space. Stateless and thread-safe: all scan
 * state lives in a per-call {@link Scan}.
 */
@Component
public class SegmentBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(SegmentBuilder.class);

  public static final int DEFAULT_MAX_SEGMENT_LENGTH = 200;

  private final int maxSegmentLength;

  public SegmentBuilder(
      @Value("${transcription.maxSegmentLength:" + DEFAULT_MAX_SEGMENT_LENGTH + "}")
          int maxSegmentLength) {
    if (maxSegmentLength <= 0) {
      throw new IllegalArgumentException("maxSegmentLength must be positive: " + maxSegmentLength);
    }
    this.maxSegmentLength = maxSegmentLength;
  }

  /**
   * Re-segment provider output.
   *
   * <p>Raw segments are flattened back into one token stream first: a raw segment with word
   * timings contributes its words, one without contributes a single token spanning the segment.
   *
   * @param rawSegments segments as returned by a provider
   * @return merged segments
   */
  public List<Segment> rebuild(List<Segment> rawSegments) {
    return build(flatten(rawSegments));
  }

  /**
   * Build segments from a token stream.
   *
   * @param tokens recognizer tokens in stream order, spacing tokens included
   * @return speaker-homogeneous segments with non-decreasing start times
   */
  public List<Segment> build(List<Word> tokens) {
    Scan scan = new Scan();
    int last = tokens.size() - 1;

    for (int i = 0; i <= last; i++) {
      Word token = tokens.get(i);

      if (token.spacing()) {
        if (!scan.sentenceWords.isEmpty()) {
          scan.sentenceText.append(token.text());
        }
        continue;
      }

      if (scan.open && !Objects.equals(token.speaker(), scan.speaker)) {
        scan.flush();
      }
      if (!scan.open) {
        scan.open = true;
        scan.speaker = token.speaker();
      }

      if (scan.sentenceText.length() > 0 && !endsWithWhitespace(scan.sentenceText)) {
        scan.sentenceText.append(' ');
      }
      scan.sentenceText.append(token.text());
      scan.sentenceWords.add(token);

      if (endsSentence(token.text()) || i == last) {
        scan.closeSentence();
      }
    }
    scan.flush();

    LOGGER.debug(
        "Built {} segments from {} tokens (maxSegmentLength={})",
        scan.segments.size(),
        tokens.size(),
        maxSegmentLength);
    return scan.segments;
  }

  /** Flatten raw provider segments into a single token stream. */
  static List<Word> flatten(List<Segment> rawSegments) {
    List<Word> tokens = new ArrayList<>();
    for (Segment raw : rawSegments) {
      if (raw.words().isEmpty()) {
        if (!raw.text().isBlank()) {
          tokens.add(Word.content(raw.start(), raw.end(), raw.text().strip(), raw.speaker(), 1.0));
        }
      } else {
        tokens.addAll(raw.words());
      }
    }
    return tokens;
  }

  static boolean endsSentence(String text) {
    String trimmed = text.stripTrailing();
    return trimmed.endsWith(".") || trimmed.endsWith("?") || trimmed.endsWith("!");
  }

  private static boolean endsWithWhitespace(CharSequence text) {
    return text.length() > 0 && Character.isWhitespace(text.charAt(text.length() - 1));
  }

  private static String joinSentences(CharSequence committed, CharSequence sentence) {
    if (committed.length() == 0) {
      return sentence.toString();
    }
    if (sentence.length() == 0) {
      return committed.toString();
    }
    if (endsWithWhitespace(committed) || Character.isWhitespace(sentence.charAt(0))) {
      return committed.toString() + sentence;
    }
    return committed + " " + sentence;
  }

  /** Mutable state of one scan over a token stream. */
  private final class Scan {

    private final List<Segment> segments = new ArrayList<>();

    private boolean open;
    private String speaker;

    private final StringBuilder committedText = new StringBuilder();
    private final List<Word> committedWords = new ArrayList<>();

    private final StringBuilder sentenceText = new StringBuilder();
    private final List<Word> sentenceWords = new ArrayList<>();

    /** Fold the in-progress sentence into the committed buffer, emitting on overflow. */
    void closeSentence() {
      if (sentenceWords.isEmpty()) {
        resetSentence();
        return;
      }

      String merged = joinSentences(committedText, sentenceText);
      if (committedText.length() == 0 || merged.length() <= maxSegmentLength) {
        committedText.setLength(0);
        committedText.append(merged);
        committedWords.addAll(sentenceWords);
      } else {
        emit(committedText.toString(), committedWords);
        resetCommitted();
        committedText.append(sentenceText);
        committedWords.addAll(sentenceWords);
      }
      resetSentence();

      if (committedText.length() > maxSegmentLength) {
        emit(committedText.toString(), committedWords);
        resetCommitted();
      }
    }

    /** End the segment in progress, including any sentence still open. */
    void flush() {
      closeSentence();
      emit(committedText.toString(), committedWords);
      resetCommitted();
      open = false;
      speaker = null;
    }

    private void emit(String text, List<Word> words) {
      String stripped = text.strip();
      if (stripped.isEmpty() || words.isEmpty()) {
        return;
      }
      segments.add(
          new Segment(
              words.get(0).start(), words.get(words.size() - 1).end(), stripped, speaker, words));
    }

    private void resetCommitted() {
      committedText.setLength(0);
      committedWords.clear();
    }

    private void resetSentence() {
      sentenceText.setLength(0);
      sentenceWords.clear();
    }
  }
}
