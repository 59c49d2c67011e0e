package com.scholary.transcripthub.media;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/** Maps between audio file extensions and media types. */
public final class MediaTypes {

  public static final String DEFAULT_AUDIO = "audio/mpeg";

  private static final Map<String, String> BY_EXTENSION =
      Map.of(
          "mp3", "audio/mpeg",
          "m4a", "audio/mp4",
          "mp4", "video/mp4",
          "wav", "audio/wav",
          "ogg", "audio/ogg",
          "flac", "audio/flac",
          "webm", "audio/webm",
          "aac", "audio/aac");

  private static final Map<String, String> BY_MEDIA_TYPE =
      Map.of(
          "audio/mpeg", "mp3",
          "audio/mp3", "mp3",
          "audio/mp4", "m4a",
          "audio/x-m4a", "m4a",
          "video/mp4", "mp4",
          "audio/wav", "wav",
          "audio/x-wav", "wav",
          "audio/ogg", "ogg",
          "audio/flac", "flac",
          "audio/webm", "webm");

  private MediaTypes() {}

  /** Media type for a file name, {@link #DEFAULT_AUDIO} when the extension is unknown. */
  public static String forFileName(String fileName) {
    String extension = extension(fileName);
    return extension == null ? DEFAULT_AUDIO : BY_EXTENSION.getOrDefault(extension, DEFAULT_AUDIO);
  }

  public static String forPath(Path path) {
    return forFileName(path.getFileName().toString());
  }

  /** File suffix, with the dot, for a media type; {@code ".bin"} when unknown. */
  public static String suffixFor(String mediaType) {
    if (mediaType == null) {
      return ".bin";
    }
    String extension = BY_MEDIA_TYPE.get(mediaType.toLowerCase(Locale.ROOT));
    return extension == null ? ".bin" : "." + extension;
  }

  static String extension(String fileName) {
    if (fileName == null) {
      return null;
    }
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      return null;
    }
    return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
