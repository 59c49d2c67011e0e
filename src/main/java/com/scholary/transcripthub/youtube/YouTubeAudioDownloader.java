package com.scholary.transcripthub.youtube;

import java.io.IOException;
import java.nio.file.Path;

/** Fetches the audio track of a YouTube video. */
public interface YouTubeAudioDownloader {

  /**
   * Download the audio of {@code videoId} into {@code directory}.
   *
   * @throws IOException if the download fails or produces no file
   */
  DownloadedAudio download(String videoId, Path directory) throws IOException;
}
