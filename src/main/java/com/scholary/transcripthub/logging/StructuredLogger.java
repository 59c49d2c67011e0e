package com.scholary.transcripthub.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Logs pipeline events with their fields in MDC, so log shippers can index them.
 *
 * <p>Event fields live only for the duration of one log call. Job context set with {@link
 * #setJobContext} stays until {@link #clearJobContext}.
 */
public class StructuredLogger {

  private static final String[] EVENT_FIELDS = {
    "event_type",
    "outcome",
    "language",
    "segmentCount",
    "durationMs",
    "errorType",
    "dataset",
    "sampleId",
    "metricValue",
    "processingSeconds",
    "processed",
    "quota"
  };

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a submission and how it was resolved: cached, in_progress or created. */
  public void logJobSubmitted(
      String jobId, String assetId, String provider, String language, String outcome) {
    try {
      MDC.put("event_type", "job_submitted");
      MDC.put("outcome", outcome);
      MDC.put("language", language);

      logger.info(
          "Job submitted: jobId={}, assetId={}, provider={}, language={}, outcome={}",
          jobId,
          assetId,
          provider,
          language,
          outcome);
    } finally {
      clearEventFields();
    }
  }

  public void logJobStarted(String jobId) {
    try {
      MDC.put("event_type", "job_started");
      logger.info("Job started: jobId={}", jobId);
    } finally {
      clearEventFields();
    }
  }

  public void logJobCompleted(String jobId, int segmentCount, String language, long durationMs) {
    try {
      MDC.put("event_type", "job_completed");
      MDC.put("segmentCount", String.valueOf(segmentCount));
      MDC.put("language", String.valueOf(language));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Job completed: jobId={}, segments={}, language={}, duration={}ms",
          jobId,
          segmentCount,
          language,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  public void logJobFailed(String jobId, String errorType, String message, long durationMs) {
    try {
      MDC.put("event_type", "job_failed");
      MDC.put("errorType", errorType);
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.error(
          "Job failed: jobId={}, error={}, message={}, duration={}ms",
          jobId,
          errorType,
          message,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  public void logEvaluationStarted(
      String provider, String dataset, String language, int processed, int quota) {
    try {
      MDC.put("event_type", "evaluation_started");
      MDC.put("dataset", dataset);
      MDC.put("language", language);
      MDC.put("processed", String.valueOf(processed));
      MDC.put("quota", String.valueOf(quota));

      logger.info(
          "Evaluation started: provider={}, dataset={}, language={}, alreadyProcessed={}, quota={}",
          provider,
          dataset,
          language,
          processed,
          quota);
    } finally {
      clearEventFields();
    }
  }

  public void logSampleEvaluated(
      String dataset, String sampleId, double metricValue, double processingSeconds) {
    try {
      MDC.put("event_type", "sample_evaluated");
      MDC.put("dataset", dataset);
      MDC.put("sampleId", sampleId);
      MDC.put("metricValue", String.valueOf(metricValue));
      MDC.put("processingSeconds", String.valueOf(processingSeconds));

      logger.info(
          "Sample evaluated: dataset={}, sampleId={}, metric={}, time={}s",
          dataset,
          sampleId,
          metricValue,
          processingSeconds);
    } finally {
      clearEventFields();
    }
  }

  public void logEvaluationStopped(
      String dataset, String sampleId, String errorType, String message) {
    try {
      MDC.put("event_type", "evaluation_stopped");
      MDC.put("dataset", dataset);
      MDC.put("sampleId", sampleId);
      MDC.put("errorType", errorType);

      logger.error(
          "Evaluation stopped: dataset={}, sampleId={}, error={}, message={}",
          dataset,
          sampleId,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String assetId, String provider) {
    MDC.put("jobId", jobId);
    MDC.put("assetId", assetId);
    MDC.put("provider", provider);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("assetId");
    MDC.remove("provider");
  }

  private void clearEventFields() {
    for (String field : EVENT_FIELDS) {
      MDC.remove(field);
    }
  }
}
