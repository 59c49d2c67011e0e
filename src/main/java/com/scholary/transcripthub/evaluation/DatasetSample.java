package com.scholary.transcripthub.evaluation;

import com.scholary.transcripthub.metrics.SpeakerTurn;
import java.nio.file.Path;
import java.util.List;

/**
 * One sample of an evaluation dataset.
 *
 * @param index position in the split; the sample id recorded in results
 * @param audio source audio file
 * @param referenceText reference transcript, {@code null} for diarization datasets
 * @param referenceTurns reference diarization, empty for transcription datasets
 */
public record DatasetSample(
    int index, Path audio, String referenceText, List<SpeakerTurn> referenceTurns) {

  public DatasetSample {
    referenceTurns = referenceTurns == null ? List.of() : List.copyOf(referenceTurns);
  }
}
