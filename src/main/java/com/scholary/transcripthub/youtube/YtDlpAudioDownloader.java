package com.scholary.transcripthub.youtube;

import com.scholary.transcripthub.media.ScopedTempFile;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link YouTubeAudioDownloader} backed by the {@code yt-dlp} command line tool.
 *
 * <p>Audio is extracted to m4a. The title is printed by yt-dlp after the file has been moved into
 * place, so a successful exit with a title line means the file exists.
 */
@Component
public class YtDlpAudioDownloader implements YouTubeAudioDownloader {

  private static final Logger LOGGER = LoggerFactory.getLogger(YtDlpAudioDownloader.class);
  private static final int LOG_SNIPPET_MAX = 2_000;
  private static final String TITLE_MARKER = "TITLE:";
  private static final long KILL_GRACE_SECONDS = 5;

  private final YouTubeProperties properties;

  /** How long to wait for the output reader once the process is gone. */
  long outputDrainMillis = TimeUnit.SECONDS.toMillis(5);

  public YtDlpAudioDownloader(YouTubeProperties properties) {
    this.properties = properties;
  }

  @Override
  public DownloadedAudio download(String videoId, Path directory) throws IOException {
    Files.createDirectories(directory);
    Path target = directory.resolve(videoId + ".m4a");

    List<String> command = buildCommand(videoId, target);
    ProcessResult result;
    try {
      result = runProcess(command, properties.timeoutMinutes());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      Files.deleteIfExists(target);
      throw new IOException("yt-dlp interrupted for " + videoId, e);
    }

    if (result.timedOut()) {
      Files.deleteIfExists(target);
      throw new IOException(
          String.format(
              "yt-dlp timed out after %dm for %s: %s",
              properties.timeoutMinutes(), videoId, truncate(result.output())));
    }
    if (result.code() != 0 || !Files.exists(target)) {
      Files.deleteIfExists(target);
      throw new IOException(
          String.format(
              "yt-dlp exit=%d for %s: %s", result.code(), videoId, truncate(result.output())));
    }

    LOGGER.info("Downloaded YouTube audio: videoId={}, target={}", videoId, target);
    return new DownloadedAudio(
        ScopedTempFile.adopt(target), extractTitle(result.output(), videoId), "audio/mp4");
  }

  List<String> buildCommand(String videoId, Path target) {
    List<String> command =
        new ArrayList<>(
            List.of(
                properties.ytDlpBinary(),
                "--no-progress",
                "--no-playlist",
                "-f",
                "bestaudio[ext=m4a]/bestaudio",
                "-x",
                "--audio-format",
                "m4a",
                "--print",
                "after_move:" + TITLE_MARKER + "%(title)s"));
    if (properties.cookiesFile() != null && !properties.cookiesFile().isBlank()) {
      command.add("--cookies");
      command.add(properties.cookiesFile());
    }
    command.add("-o");
    command.add(target.toString());
    command.add("https://www.youtube.com/watch?v=" + videoId);
    return command;
  }

  static String extractTitle(String output, String fallback) {
    for (String line : output.split("\\R")) {
      if (line.startsWith(TITLE_MARKER)) {
        String title = line.substring(TITLE_MARKER.length()).trim();
        if (!title.isEmpty()) {
          return title;
        }
      }
    }
    return fallback;
  }

  ProcessResult runProcess(List<String> command, long timeoutMinutes)
      throws IOException, InterruptedException {
    Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
    return awaitProcess(process, timeoutMinutes, TimeUnit.MINUTES);
  }

  /**
   * Collect the output of {@code process} and wait for it to exit. The process is killed when it
   * outlives {@code timeout} or the waiting thread is interrupted.
   */
  ProcessResult awaitProcess(Process process, long timeout, TimeUnit unit)
      throws InterruptedException {
    StringJoiner output = new StringJoiner(System.lineSeparator());
    Thread reader =
        new Thread(
            () -> {
              try (BufferedReader in =
                  new BufferedReader(
                      new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = in.readLine()) != null) {
                  synchronized (output) {
                    output.add(line);
                  }
                }
              } catch (IOException e) {
                throw new UncheckedIOException(e);
              }
            },
            "yt-dlp-output");
    reader.setDaemon(true);
    reader.setUncaughtExceptionHandler(
        (thread, e) -> LOGGER.warn("Lost yt-dlp output: {}", e.getMessage()));
    reader.start();

    boolean finished = false;
    try {
      finished = process.waitFor(timeout, unit);
    } finally {
      if (!finished) {
        process.destroyForcibly();
      }
    }
    if (!finished) {
      process.waitFor(KILL_GRACE_SECONDS, TimeUnit.SECONDS);
    }
    reader.join(outputDrainMillis);
    if (reader.isAlive()) {
      LOGGER.warn(
          "yt-dlp output still open {}ms after exit, returning partial output", outputDrainMillis);
    }
    String collected;
    synchronized (output) {
      collected = output.toString();
    }
    return new ProcessResult(finished ? process.exitValue() : -1, collected, !finished);
  }

  private static String truncate(String output) {
    if (output == null || output.isBlank()) {
      return "<no output>";
    }
    return output.length() <= LOG_SNIPPET_MAX
        ? output
        : output.substring(output.length() - LOG_SNIPPET_MAX);
  }

  record ProcessResult(int code, String output, boolean timedOut) {}
}
