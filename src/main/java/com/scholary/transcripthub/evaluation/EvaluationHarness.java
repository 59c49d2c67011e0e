package com.scholary.transcripthub.evaluation;

import com.scholary.transcripthub.exception.NotFoundException;
import com.scholary.transcripthub.exception.ProviderException;
import com.scholary.transcripthub.logging.StructuredLogger;
import com.scholary.transcripthub.media.ScopedTempFile;
import com.scholary.transcripthub.provider.ProviderResult;
import com.scholary.transcripthub.provider.TranscriptionProvider;
import com.scholary.transcripthub.segment.Segment;
import com.scholary.transcripthub.segment.SegmentBuilder;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs a dataset through a provider and records per-sample metrics.
 *
 * <p>Runs are resumable: samples already present in the persisted table are skipped, and the table
 * is saved after every sample. The first provider failure stops the run; everything recorded
 * before it stays on disk and the failure is rethrown.
 */
@Component
public class EvaluationHarness {

  private static final Logger LOGGER = LoggerFactory.getLogger(EvaluationHarness.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  /** Pause between provider calls. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }

  private final EvaluationResultStore resultStore;
  private final SegmentBuilder segmentBuilder;
  private final Path tempDir;
  private final Duration delay;
  private final Sleeper sleeper;

  @Autowired
  public EvaluationHarness(
      EvaluationResultStore resultStore,
      SegmentBuilder segmentBuilder,
      EvaluationProperties properties) {
    this(
        resultStore,
        segmentBuilder,
        Path.of(properties.tempDir()),
        Duration.ofMillis(properties.delayMillis()),
        duration -> Thread.sleep(duration.toMillis()));
  }

  EvaluationHarness(
      EvaluationResultStore resultStore,
      SegmentBuilder segmentBuilder,
      Path tempDir,
      Duration delay,
      Sleeper sleeper) {
    this.resultStore = resultStore;
    this.segmentBuilder = segmentBuilder;
    this.tempDir = tempDir;
    this.delay = delay;
    this.sleeper = sleeper;
  }

  /**
   * Evaluate up to {@code limit} samples of a split in total, counting samples recorded by earlier
   * runs.
   *
   * @param limit total sample budget; 0 or less means the whole split
   * @return the report over every recorded sample
   * @throws ProviderException if the provider fails on a sample, after earlier rows are saved
   * @throws IOException if the dataset or the results table cannot be read or written
   */
  public EvaluationReport evaluate(
      EvaluationDataset dataset, TranscriptionProvider provider, String split, int limit)
      throws IOException {
    String providerName = provider.name();
    List<DatasetSample> samples = dataset.load(split);
    List<EvaluationRecord> records =
        resultStore.load(providerName, dataset.name(), dataset.language());

    Set<Integer> processed = new HashSet<>();
    for (EvaluationRecord record : records) {
      processed.add(record.sampleId());
    }

    int quota = limit > 0 ? limit - processed.size() : samples.size() - processed.size();
    if (quota <= 0) {
      LOGGER.info(
          "Nothing to evaluate for {} on {}: {} samples already recorded",
          providerName,
          dataset.name(),
          processed.size());
      return logged(EvaluationReport.of(providerName, dataset, records));
    }

    STRUCTURED_LOGGER.logEvaluationStarted(
        providerName, dataset.name(), dataset.language(), processed.size(), quota);

    int done = 0;
    for (DatasetSample sample : samples) {
      if (done >= quota) {
        break;
      }
      if (processed.contains(sample.index())) {
        continue;
      }
      if (done > 0) {
        pause();
      }

      EvaluationRecord record = evaluateSample(dataset, provider, sample);
      records.add(record);
      processed.add(sample.index());
      resultStore.save(providerName, dataset.name(), dataset.language(), records);
      STRUCTURED_LOGGER.logSampleEvaluated(
          dataset.name(),
          String.valueOf(record.sampleId()),
          record.metricValue(),
          record.processingTime());
      done++;
    }

    return logged(EvaluationReport.of(providerName, dataset, records));
  }

  /**
   * Rebuild the report for a previous run from its persisted table.
   *
   * @throws NotFoundException if the provider was never evaluated on this dataset
   */
  public EvaluationReport report(EvaluationDataset dataset, String providerName)
      throws IOException {
    if (!resultStore.exists(providerName, dataset.name(), dataset.language())) {
      throw new NotFoundException(
          String.format(
              "No evaluation results for provider '%s' on %s/%s",
              providerName, dataset.name(), dataset.language()));
    }
    List<EvaluationRecord> records =
        resultStore.load(providerName, dataset.name(), dataset.language());
    return logged(EvaluationReport.of(providerName, dataset, records));
  }

  private EvaluationRecord evaluateSample(
      EvaluationDataset dataset, TranscriptionProvider provider, DatasetSample sample)
      throws IOException {
    try (ScopedTempFile audio = dataset.prepareAudio(sample, tempDir)) {
      long started = System.nanoTime();
      ProviderResult result = provider.transcribe(audio.path(), dataset.language());
      double seconds = (System.nanoTime() - started) / 1_000_000_000.0;

      if (!result.isSuccess()) {
        ProviderException error = result.error();
        STRUCTURED_LOGGER.logEvaluationStopped(
            dataset.name(),
            String.valueOf(sample.index()),
            error.getClass().getSimpleName(),
            error.getMessage());
        throw error;
      }

      List<Segment> segments = segmentBuilder.rebuild(result.recognition().segments());
      return dataset.score(sample, segments, seconds);
    }
  }

  private void pause() {
    if (delay.isZero()) {
      return;
    }
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted between evaluation samples", e);
    }
  }

  private static EvaluationReport logged(EvaluationReport report) {
    LOGGER.info(report.format());
    return report;
  }
}
