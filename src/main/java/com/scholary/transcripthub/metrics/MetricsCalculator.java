package com.scholary.transcripthub.metrics;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Error-rate metrics for transcription evaluation.
 *
 * <p>WER and CER normalize both texts before scoring. Corpus-level WER concatenates all samples
 * and scores once (micro-average) instead of averaging per-sample rates, so long samples weigh
 * more than short ones.
 */
@Component
public class MetricsCalculator {

  private static final Pattern NON_WORD =
      Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern WHITESPACE =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern CJK_IDEOGRAPH = Pattern.compile("([\\u4e00-\\u9fff])");

  /** ASCII and full-width punctuation removed before character-level scoring. */
  static final String CER_PUNCTUATION =
      "!\"'＂＃＄％＆＇（）＊＋，－／：；＜＝＞＠［＼］＾＿｀｛｜｝～｟｠｢｣､、〃》「」『』【】〔〕〖〗〘〙〚〛〜〝〞〟"
          + "〰〾〿–—‘’‛“”„‟…‧﹏。',.?、；：！~·#￥%……&*（）——+|{}【】‘’“”《》？。，、；：";

  private final DiarizationErrorRate diarizationErrorRate = new DiarizationErrorRate();

  /**
   * Word error rate after lowercasing, punctuation removal and whitespace collapsing.
   *
   * @return {@code (substitutions + insertions + deletions) / reference words}
   */
  public double wer(String reference, String hypothesis) {
    return errorRate(normalizeWords(reference), normalizeWords(hypothesis));
  }

  /**
   * Corpus-level word error rate: references and hypotheses are joined with newlines and scored
   * once.
   */
  public double corpusWer(List<String> references, List<String> hypotheses) {
    if (references.size() != hypotheses.size()) {
      throw new IllegalArgumentException(
          String.format(
              "references and hypotheses differ in size: %d vs %d",
              references.size(), hypotheses.size()));
    }
    return wer(String.join("\n", references), String.join("\n", hypotheses));
  }

  /**
   * Character error rate for character-based languages.
   *
   * <p>Each CJK ideograph becomes its own token, so the word-level alignment scores characters.
   */
  public double cer(String reference, String hypothesis) {
    return errorRate(normalizeCharacters(reference), normalizeCharacters(hypothesis));
  }

  /**
   * Diarization error rate under the optimal speaker mapping.
   *
   * @see DiarizationErrorRate
   */
  public double der(List<SpeakerTurn> reference, List<SpeakerTurn> hypothesis) {
    return diarizationErrorRate.compute(reference, hypothesis);
  }

  static String normalizeWords(String text) {
    if (text == null) {
      return "";
    }
    String lower = text.toLowerCase(Locale.ROOT);
    String stripped = NON_WORD.matcher(lower).replaceAll("");
    return WHITESPACE.matcher(stripped).replaceAll(" ").strip();
  }

  static String normalizeCharacters(String text) {
    if (text == null) {
      return "";
    }
    String lower = text.toLowerCase(Locale.ROOT);
    StringBuilder kept = new StringBuilder(lower.length());
    lower
        .codePoints()
        .filter(cp -> CER_PUNCTUATION.indexOf(cp) < 0)
        .forEach(kept::appendCodePoint);
    String separated = CJK_IDEOGRAPH.matcher(kept).replaceAll(" $1 ");
    return WHITESPACE.matcher(separated).replaceAll(" ").strip();
  }

  /**
   * Word-level Levenshtein distance divided by the reference length.
   *
   * <p>An empty reference scores 0 against an empty hypothesis and 1 otherwise.
   */
  static double errorRate(String normalizedReference, String normalizedHypothesis) {
    String[] ref = tokens(normalizedReference);
    String[] hyp = tokens(normalizedHypothesis);
    if (ref.length == 0) {
      return hyp.length == 0 ? 0.0 : 1.0;
    }
    return (double) editDistance(ref, hyp) / ref.length;
  }

  static int editDistance(String[] ref, String[] hyp) {
    int[] previous = new int[hyp.length + 1];
    int[] current = new int[hyp.length + 1];
    for (int j = 0; j <= hyp.length; j++) {
      previous[j] = j;
    }
    for (int i = 1; i <= ref.length; i++) {
      current[0] = i;
      for (int j = 1; j <= hyp.length; j++) {
        int substitution = previous[j - 1] + (ref[i - 1].equals(hyp[j - 1]) ? 0 : 1);
        int deletion = previous[j] + 1;
        int insertion = current[j - 1] + 1;
        current[j] = Math.min(substitution, Math.min(deletion, insertion));
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[hyp.length];
  }

  private static String[] tokens(String normalized) {
    return normalized.isEmpty() ? new String[0] : normalized.split(" ");
  }
}
