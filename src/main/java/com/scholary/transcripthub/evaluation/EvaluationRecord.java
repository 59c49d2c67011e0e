package com.scholary.transcripthub.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One scored dataset sample, one row of the results table.
 *
 * @param sampleId index of the sample in its split
 * @param reference reference transcript, or serialized reference diarization
 * @param hypothesis provider transcript, or serialized provider diarization
 * @param metricValue per-sample error rate
 * @param processingTime provider call duration in seconds
 */
@JsonPropertyOrder({"sample_id", "reference", "hypothesis", "metric_value", "processing_time"})
public record EvaluationRecord(
    @JsonProperty("sample_id") int sampleId,
    @JsonProperty("reference") String reference,
    @JsonProperty("hypothesis") String hypothesis,
    @JsonProperty("metric_value") double metricValue,
    @JsonProperty("processing_time") double processingTime) {}
