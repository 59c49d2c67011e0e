package com.scholary.transcripthub.evaluation;

import com.scholary.transcripthub.media.MediaTypes;
import com.scholary.transcripthub.media.ScopedTempFile;
import com.scholary.transcripthub.segment.Segment;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;

/** A reference dataset and the way its samples are scored. */
public interface EvaluationDataset {

  /** Name used in result file names, such as {@code common_voice}. */
  String name();

  String language();

  /**
   * Load the samples of a split, in a stable order.
   *
   * @throws IOException if the split cannot be read
   */
  List<DatasetSample> load(String split) throws IOException;

  /** Copy a sample's audio into a temp file owned by the caller. */
  default ScopedTempFile prepareAudio(DatasetSample sample, Path tempDir) throws IOException {
    String fileName = sample.audio().getFileName().toString();
    String suffix = MediaTypes.suffixFor(MediaTypes.forFileName(fileName));
    ScopedTempFile copy = ScopedTempFile.create(tempDir, "sample_" + sample.index() + "_", suffix);
    try {
      Files.copy(sample.audio(), copy.path(), StandardCopyOption.REPLACE_EXISTING);
      return copy;
    } catch (IOException e) {
      copy.close();
      throw e;
    }
  }

  /** Score one sample against the segments a provider produced for it. */
  EvaluationRecord score(DatasetSample sample, List<Segment> segments, double processingSeconds);

  /** Aggregate metrics over all recorded samples, keyed by metric name. */
  Map<String, Double> aggregate(List<EvaluationRecord> records);
}
