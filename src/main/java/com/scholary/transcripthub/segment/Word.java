package com.scholary.transcripthub.segment;

/**
 * One token of a diarizing recognizer's output.
 *
 * <p>Content tokens carry the spoken text. Spacing tokens ({@code spacing == true}) carry the
 * whitespace or punctuation filler a recognizer emits between content tokens; they contribute to
 * the reconstructed text but never become part of a {@link Segment}'s word list.
 *
 * @param start start time in seconds
 * @param end end time in seconds
 * @param text literal token text
 * @param speaker speaker label assigned by diarization, may be {@code null} when unknown
 * @param confidence recognizer confidence in [0, 1]
 * @param spacing whether this is an inter-token filler rather than content
 */
public record Word(
    double start, double end, String text, String speaker, double confidence, boolean spacing) {

  public Word {
    if (text == null) {
      text = "";
    }
  }

  public static Word content(
      double start, double end, String text, String speaker, double confidence) {
    return new Word(start, end, text, speaker, confidence, false);
  }

  public static Word spacing(double start, double end, String text, String speaker) {
    return new Word(start, end, text, speaker, 1.0, true);
  }
}
