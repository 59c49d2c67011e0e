package com.scholary.transcripthub.provider.whisperx;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Settings for the self-hosted WhisperX server, bound from {@code providers.whisperx.*}. */
@ConfigurationProperties(prefix = "providers.whisperx")
@Validated
public record WhisperxProperties(
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {}
