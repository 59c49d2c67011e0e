package com.scholary.transcripthub.provider.elevenlabs;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * ElevenLabs speech-to-text client settings, bound from {@code providers.elevenlabs.*}.
 *
 * <p>A blank {@code apiKey} leaves the provider registered but every call fails.
 */
@ConfigurationProperties(prefix = "providers.elevenlabs")
@Validated
public record ElevenLabsProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String modelId,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {}
