package com.scholary.transcripthub.youtube;

import com.scholary.transcripthub.media.ScopedTempFile;

/**
 * Audio extracted from a video. The caller owns {@code file} and must close it.
 *
 * @param file local audio file
 * @param title video title
 * @param mimeType media type of the audio container
 */
public record DownloadedAudio(ScopedTempFile file, String title, String mimeType) {}
