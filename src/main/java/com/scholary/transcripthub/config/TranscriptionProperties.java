package com.scholary.transcripthub.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the job pipeline.
 *
 * <p>Controls temp storage, executor sizing, segment length and upload limits.
 */
@ConfigurationProperties(prefix = "transcription")
@Validated
public record TranscriptionProperties(
    @NotBlank String tempDir,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize,
    @Positive int maxSegmentLength,
    @Positive long maxUploadBytes) {}
