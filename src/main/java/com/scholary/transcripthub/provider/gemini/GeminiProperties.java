package com.scholary.transcripthub.provider.gemini;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Gemini API settings, bound from {@code providers.gemini.*}. Shared by transcription and
 * summarization.
 *
 * @param maxInlineBytes largest audio file sent inline with the request; larger files go through
 *     the Files API
 * @param filePollIntervalMillis delay between state checks of an uploaded file
 * @param filePollMaxAttempts state checks before an upload still processing is given up on
 */
@ConfigurationProperties(prefix = "providers.gemini")
@Validated
public record GeminiProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    @Positive long maxInlineBytes,
    @Positive long filePollIntervalMillis,
    @Positive int filePollMaxAttempts) {}
