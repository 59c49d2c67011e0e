package com.scholary.transcripthub.youtube;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * yt-dlp settings, bound from {@code youtube.*}.
 *
 * @param ytDlpBinary executable name or path
 * @param timeoutMinutes hard limit for one download
 * @param cookiesFile optional cookies file for videos behind a sign-in wall
 */
@ConfigurationProperties(prefix = "youtube")
@Validated
public record YouTubeProperties(
    @NotBlank String ytDlpBinary, @Positive long timeoutMinutes, String cookiesFile) {}
