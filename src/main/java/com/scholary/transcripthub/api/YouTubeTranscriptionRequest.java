package com.scholary.transcripthub.api;

import jakarta.validation.constraints.NotBlank;

/** Request to transcribe the audio of a YouTube video. */
public record YouTubeTranscriptionRequest(
    @NotBlank String url, @NotBlank String provider, String language) {}
