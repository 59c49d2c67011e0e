package com.scholary.transcripthub.evaluation;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.scholary.transcripthub.metrics.MetricsCalculator;
import com.scholary.transcripthub.segment.Segment;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mozilla Common Voice, in its release layout: {@code <root>/<split>.tsv} with {@code path} and
 * {@code sentence} columns, audio under {@code <root>/clips}.
 *
 * <p>Scored by word error rate. The aggregate is corpus level: all references and all hypotheses
 * are joined and scored once, so longer samples weigh more.
 */
public class CommonVoiceDataset implements EvaluationDataset {

  public static final String NAME = "common_voice";

  private static final Logger LOGGER = LoggerFactory.getLogger(CommonVoiceDataset.class);

  private static final CsvSchema TSV =
      CsvSchema.emptySchema().withHeader().withColumnSeparator('\t').withoutQuoteChar();

  private final Path root;
  private final String language;
  private final MetricsCalculator metrics;
  private final CsvMapper csvMapper = new CsvMapper();

  public CommonVoiceDataset(Path root, String language, MetricsCalculator metrics) {
    this.root = root;
    this.language = language;
    this.metrics = metrics;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String language() {
    return language;
  }

  @Override
  public List<DatasetSample> load(String split) throws IOException {
    Path tsv = root.resolve(split + ".tsv");
    LOGGER.info("Loading Common Voice split '{}' for language '{}' from {}", split, language, tsv);

    List<DatasetSample> samples = new ArrayList<>();
    try (Reader reader = Files.newBufferedReader(tsv, StandardCharsets.UTF_8);
        MappingIterator<Map<String, String>> rows =
            csvMapper.readerForMapOf(String.class).with(TSV).readValues(reader)) {
      while (rows.hasNext()) {
        Map<String, String> row = rows.next();
        String clip = row.get("path");
        if (clip == null || clip.isBlank()) {
          throw new IOException("Row " + samples.size() + " of " + tsv + " has no 'path'");
        }
        samples.add(
            new DatasetSample(
                samples.size(),
                root.resolve("clips").resolve(clip),
                row.getOrDefault("sentence", ""),
                List.of()));
      }
    }
    LOGGER.info("Loaded {} samples", samples.size());
    return samples;
  }

  @Override
  public EvaluationRecord score(
      DatasetSample sample, List<Segment> segments, double processingSeconds) {
    String hypothesis = segments.stream().map(Segment::text).collect(Collectors.joining(" "));
    String reference = sample.referenceText() == null ? "" : sample.referenceText();
    return new EvaluationRecord(
        sample.index(),
        reference,
        hypothesis,
        metrics.wer(reference, hypothesis),
        processingSeconds);
  }

  @Override
  public Map<String, Double> aggregate(List<EvaluationRecord> records) {
    List<String> references = new ArrayList<>(records.size());
    List<String> hypotheses = new ArrayList<>(records.size());
    for (EvaluationRecord record : records) {
      references.add(record.reference() == null ? "" : record.reference());
      hypotheses.add(record.hypothesis() == null ? "" : record.hypothesis());
    }
    return Map.of("WER", metrics.corpusWer(references, hypotheses));
  }
}
