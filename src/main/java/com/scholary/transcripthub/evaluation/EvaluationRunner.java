package com.scholary.transcripthub.evaluation;

import com.scholary.transcripthub.exception.ValidationException;
import com.scholary.transcripthub.provider.ProviderRegistry;
import com.scholary.transcripthub.provider.TranscriptionProvider;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Command-line entry point for evaluations, active under the {@code evaluate} profile:
 *
 * <pre>
 * java -jar transcript-hub.jar --spring.profiles.active=evaluate \
 *     --mode=evaluate --provider=elevenlabs --dataset=common_voice --language=en \
 *     --split=test --limit=50
 * </pre>
 *
 * <p>{@code --mode=report} prints the report of a previous run without calling the provider.
 */
@Component
@Profile("evaluate")
public class EvaluationRunner implements ApplicationRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(EvaluationRunner.class);

  static final String MODE_EVALUATE = "evaluate";
  static final String MODE_REPORT = "report";

  private final EvaluationHarness harness;
  private final EvaluationDatasets datasets;
  private final ProviderRegistry providers;

  public EvaluationRunner(
      EvaluationHarness harness, EvaluationDatasets datasets, ProviderRegistry providers) {
    this.harness = harness;
    this.datasets = datasets;
    this.providers = providers;
  }

  @Override
  public void run(ApplicationArguments args) throws Exception {
    String mode = option(args, "mode", MODE_EVALUATE);
    String providerName = required(args, "provider");
    EvaluationDataset dataset =
        datasets.get(required(args, "dataset"), option(args, "language", "en"));

    EvaluationReport report;
    if (MODE_REPORT.equals(mode)) {
      report = harness.report(dataset, providerName);
    } else if (MODE_EVALUATE.equals(mode)) {
      TranscriptionProvider provider = providers.get(providerName);
      report = harness.evaluate(dataset, provider, option(args, "split", "test"), limit(args));
    } else {
      throw new ValidationException(
          "Unknown mode '" + mode + "', expected " + MODE_EVALUATE + " or " + MODE_REPORT);
    }
    LOGGER.info(
        "Finished {} for {} on {}/{}", mode, providerName, dataset.name(), dataset.language());
    System.out.println(report.format());
  }

  private static int limit(ApplicationArguments args) {
    String value = option(args, "limit", "0");
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new ValidationException("--limit must be an integer, got '" + value + "'");
    }
  }

  private static String required(ApplicationArguments args, String name) {
    String value = option(args, name, null);
    if (value == null || value.isBlank()) {
      throw new ValidationException("--" + name + " is required");
    }
    return value;
  }

  static String option(ApplicationArguments args, String name, String fallback) {
    List<String> values = args.getOptionValues(name);
    if (values == null || values.isEmpty()) {
      return fallback;
    }
    return values.get(values.size() - 1);
  }
}
