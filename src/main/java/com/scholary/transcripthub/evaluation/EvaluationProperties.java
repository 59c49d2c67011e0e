package com.scholary.transcripthub.evaluation;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Evaluation harness settings, bound from {@code evaluation.*}. */
@Validated
@ConfigurationProperties(prefix = "evaluation")
public record EvaluationProperties(
    @NotBlank String resultsDir,
    @NotBlank String datasetsRoot,
    @NotBlank String tempDir,
    @PositiveOrZero long delayMillis) {}
