package com.scholary.transcripthub.objectstore;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for media object storage, bound from {@code objectstore.*}.
 *
 * @param mediaPrefix key prefix under which asset bytes are stored
 * @param presignTtlMinutes lifetime of playback URLs
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    @NotBlank String endpoint,
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess,
    @NotBlank String mediaPrefix,
    @Positive int presignTtlMinutes) {}
