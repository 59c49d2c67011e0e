package com.scholary.transcripthub.evaluation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcripthub.exception.ValidationException;
import com.scholary.transcripthub.metrics.MetricsCalculator;
import java.nio.file.Path;
import java.util.List;
import org.springframework.stereotype.Component;

/** Creates datasets by name, rooted at {@code <datasetsRoot>/<name>/<language>}. */
@Component
public class EvaluationDatasets {

  private final Path datasetsRoot;
  private final MetricsCalculator metrics;
  private final ObjectMapper objectMapper;

  public EvaluationDatasets(
      EvaluationProperties properties, MetricsCalculator metrics, ObjectMapper objectMapper) {
    this(Path.of(properties.datasetsRoot()), metrics, objectMapper);
  }

  EvaluationDatasets(Path datasetsRoot, MetricsCalculator metrics, ObjectMapper objectMapper) {
    this.datasetsRoot = datasetsRoot;
    this.metrics = metrics;
    this.objectMapper = objectMapper;
  }

  public EvaluationDataset get(String name, String language) {
    if (language == null || language.isBlank()) {
      throw new ValidationException("language is required");
    }
    if (CommonVoiceDataset.NAME.equals(name)) {
      return new CommonVoiceDataset(
          datasetsRoot.resolve(CommonVoiceDataset.NAME).resolve(language), language, metrics);
    }
    if (CallHomeDataset.NAME.equals(name)) {
      return new CallHomeDataset(
          datasetsRoot.resolve(CallHomeDataset.NAME).resolve(language),
          language,
          metrics,
          objectMapper);
    }
    throw new ValidationException(
        "Unknown dataset '" + name + "', expected one of " + names());
  }

  public List<String> names() {
    return List.of(CommonVoiceDataset.NAME, CallHomeDataset.NAME);
  }
}
