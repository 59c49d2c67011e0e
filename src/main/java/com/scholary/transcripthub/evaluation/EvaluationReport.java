package com.scholary.transcripthub.evaluation;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregated outcome of an evaluation run.
 *
 * @param samples number of recorded samples
 * @param metrics aggregate metrics keyed by name, such as {@code WER} or {@code DER}
 */
public record EvaluationReport(
    String provider,
    String dataset,
    String language,
    int samples,
    Map<String, Double> metrics,
    TimeStats time) {

  public EvaluationReport {
    metrics = Map.copyOf(metrics);
  }

  /** Processing-time statistics over the recorded samples. */
  public record TimeStats(double averageSeconds, double totalSeconds, double totalMinutes) {

    static TimeStats of(List<EvaluationRecord> records) {
      double total = records.stream().mapToDouble(EvaluationRecord::processingTime).sum();
      double average = records.isEmpty() ? 0.0 : total / records.size();
      return new TimeStats(average, total, total / 60.0);
    }
  }

  static EvaluationReport of(
      String provider, EvaluationDataset dataset, List<EvaluationRecord> records) {
    return new EvaluationReport(
        provider,
        dataset.name(),
        dataset.language(),
        records.size(),
        records.isEmpty() ? Map.of() : dataset.aggregate(records),
        TimeStats.of(records));
  }

  /** Multi-line, human-readable rendering for logs and the command line. */
  public String format() {
    StringBuilder out = new StringBuilder();
    out.append(
        String.format(
            Locale.ROOT,
            "Evaluation report: provider=%s, dataset=%s, language=%s, samples=%d%n",
            provider,
            dataset,
            language,
            samples));
    new TreeMap<>(metrics)
        .forEach(
            (name, value) ->
                out.append(String.format(Locale.ROOT, "  %s: %.4f%n", name, value)));
    out.append(
        String.format(
            Locale.ROOT,
            "  average time: %.2fs, total time: %.2fs (%.2f min)",
            time.averageSeconds(),
            time.totalSeconds(),
            time.totalMinutes()));
    return out.toString();
  }
}
