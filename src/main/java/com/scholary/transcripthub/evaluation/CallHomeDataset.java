package com.scholary.transcripthub.evaluation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcripthub.metrics.MetricsCalculator;
import com.scholary.transcripthub.metrics.SpeakerTurn;
import com.scholary.transcripthub.segment.Segment;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CallHome speaker diarization, as a JSON-lines manifest {@code <root>/<split>.jsonl}:
 *
 * <pre>
 * {"audio": "audio/0001.wav", "timestamps_start": [0.0, 4.2], "timestamps_end": [4.0, 9.1],
 *  "speakers": ["A", "B"]}
 * </pre>
 *
 * <p>Audio paths are relative to the root. The corpus ships a single split named {@code data};
 * any other requested split falls back to it when its manifest is missing. Scored by diarization
 * error rate, averaged over samples.
 */
public class CallHomeDataset implements EvaluationDataset {

  public static final String NAME = "callhome";
  static final String DEFAULT_SPLIT = "data";

  private static final Logger LOGGER = LoggerFactory.getLogger(CallHomeDataset.class);
  private static final TypeReference<List<SpeakerTurn>> TURNS = new TypeReference<>() {};

  private final Path root;
  private final String language;
  private final MetricsCalculator metrics;
  private final ObjectMapper objectMapper;

  public CallHomeDataset(
      Path root, String language, MetricsCalculator metrics, ObjectMapper objectMapper) {
    this.root = root;
    this.language = language;
    this.metrics = metrics;
    this.objectMapper = objectMapper;
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
    Path manifest = root.resolve(split + ".jsonl");
    if (!Files.exists(manifest) && !DEFAULT_SPLIT.equals(split)) {
      LOGGER.info("No CallHome split '{}', using '{}'", split, DEFAULT_SPLIT);
      manifest = root.resolve(DEFAULT_SPLIT + ".jsonl");
    }
    LOGGER.info("Loading CallHome for language '{}' from {}", language, manifest);

    List<DatasetSample> samples = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(manifest, StandardCharsets.UTF_8)) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        samples.add(parseLine(line, samples.size(), manifest, lineNumber));
      }
    }
    LOGGER.info("Loaded {} samples", samples.size());
    return samples;
  }

  private DatasetSample parseLine(String line, int index, Path manifest, int lineNumber)
      throws IOException {
    JsonNode node = objectMapper.readTree(line);
    String audio = node.path("audio").asText(null);
    JsonNode starts = node.path("timestamps_start");
    JsonNode ends = node.path("timestamps_end");
    JsonNode speakers = node.path("speakers");
    if (audio == null || !starts.isArray() || !ends.isArray() || !speakers.isArray()) {
      throw new IOException(
          String.format(
              "%s line %d: expected audio, timestamps and speakers", manifest, lineNumber));
    }
    if (starts.size() != ends.size() || starts.size() != speakers.size()) {
      throw new IOException(
          String.format(
              "%s line %d: timestamp and speaker lists differ in length", manifest, lineNumber));
    }

    List<SpeakerTurn> turns = new ArrayList<>(starts.size());
    for (int i = 0; i < starts.size(); i++) {
      turns.add(
          new SpeakerTurn(
              starts.get(i).asDouble(), ends.get(i).asDouble(), speakers.get(i).asText()));
    }
    return new DatasetSample(index, root.resolve(audio), null, turns);
  }

  @Override
  public EvaluationRecord score(
      DatasetSample sample, List<Segment> segments, double processingSeconds) {
    List<SpeakerTurn> hypothesis = new ArrayList<>(segments.size());
    for (Segment segment : segments) {
      hypothesis.add(
          new SpeakerTurn(
              segment.start(),
              segment.end(),
              segment.speaker() == null ? "unknown" : segment.speaker()));
    }
    return new EvaluationRecord(
        sample.index(),
        toJson(sample.referenceTurns()),
        toJson(hypothesis),
        metrics.der(sample.referenceTurns(), hypothesis),
        processingSeconds);
  }

  @Override
  public Map<String, Double> aggregate(List<EvaluationRecord> records) {
    double average =
        records.stream().mapToDouble(EvaluationRecord::metricValue).average().orElse(0.0);
    return Map.of("DER", average);
  }

  /** Read back a diarization serialized by {@link #score}. */
  List<SpeakerTurn> readTurns(String json) throws IOException {
    return objectMapper.readValue(json, TURNS);
  }

  private String toJson(List<SpeakerTurn> turns) {
    try {
      return objectMapper.writeValueAsString(turns);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }
}
