package com.scholary.transcripthub.evaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.scholary.transcripthub.metrics.MetricsCalculator;
import com.scholary.transcripthub.segment.Segment;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CommonVoiceDatasetTest {

  private Path root;
  private CommonVoiceDataset dataset;

  @BeforeEach
  void setUp() throws Exception {
    root = Path.of(getClass().getResource("/datasets/common_voice/en").toURI());
    dataset = new CommonVoiceDataset(root, "en", new MetricsCalculator());
  }

  @Test
  void load_shouldReadTsvRowsInOrder() throws Exception {
    List<DatasetSample> samples = dataset.load("test");

    assertThat(samples).extracting(DatasetSample::index).containsExactly(0, 1, 2);
    assertThat(samples.get(0).audio())
        .isEqualTo(root.resolve("clips").resolve("common_voice_en_0001.mp3"));
    assertThat(samples.get(1).referenceText()).isEqualTo("The \"quick\" brown fox, jumps.");
    assertThat(samples.get(2).referenceTurns()).isEmpty();
  }

  @Test
  void score_shouldJoinSegmentsAndComputeWer() throws Exception {
    DatasetSample sample = dataset.load("test").get(1);
    List<Segment> segments =
        List.of(
            new Segment(0.0, 1.0, "the quick brown", "A", List.of()),
            new Segment(1.0, 2.0, "fox jumped", "A", List.of()));

    EvaluationRecord record = dataset.score(sample, segments, 1.5);

    assertThat(record.sampleId()).isEqualTo(1);
    assertThat(record.hypothesis()).isEqualTo("the quick brown fox jumped");
    assertThat(record.metricValue()).isCloseTo(0.2, within(1e-9));
    assertThat(record.processingTime()).isEqualTo(1.5);
  }

  @Test
  void aggregate_shouldPoolWordsAcrossSamples() {
    List<EvaluationRecord> records =
        List.of(
            new EvaluationRecord(0, "one", "uno", 1.0, 1.0),
            new EvaluationRecord(1, "two three four five", "two three four five", 0.0, 1.0));

    Map<String, Double> metrics = dataset.aggregate(records);

    assertThat(metrics).containsOnlyKeys("WER");
    assertThat(metrics.get("WER")).isCloseTo(0.2, within(1e-9));
  }
}
