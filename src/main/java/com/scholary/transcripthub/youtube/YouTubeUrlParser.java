package com.scholary.transcripthub.youtube;

import com.scholary.transcripthub.exception.ValidationException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Extracts the video id from the YouTube URL shapes users paste: {@code watch?v=}, {@code
 * youtu.be/}, {@code /shorts/}, {@code /embed/} and {@code /live/}.
 */
public final class YouTubeUrlParser {

  private static final Pattern VIDEO_ID = Pattern.compile("[A-Za-z0-9_-]{11}");

  private YouTubeUrlParser() {}

  /**
   * @throws ValidationException if the URL is not a YouTube video URL
   */
  public static String videoId(String url) {
    if (url == null || url.isBlank()) {
      throw new ValidationException("YouTube URL is required");
    }

    URI uri;
    try {
      uri = new URI(url.trim());
    } catch (URISyntaxException e) {
      throw new ValidationException("Malformed YouTube URL: " + url);
    }

    String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
    String path = uri.getPath() == null ? "" : uri.getPath();
    String candidate = null;

    if (host.equals("youtu.be") || host.endsWith(".youtu.be")) {
      candidate = firstPathElement(path);
    } else if (host.equals("youtube.com") || host.endsWith(".youtube.com")) {
      if (path.equals("/watch")) {
        candidate = queryParameter(uri.getRawQuery(), "v");
      } else if (path.startsWith("/shorts/")
          || path.startsWith("/embed/")
          || path.startsWith("/live/")) {
        candidate = firstPathElement(path.substring(path.indexOf('/', 1)));
      }
    }

    if (candidate == null || !VIDEO_ID.matcher(candidate).matches()) {
      throw new ValidationException("Not a YouTube video URL: " + url);
    }
    return candidate;
  }

  private static String firstPathElement(String path) {
    String trimmed = path.startsWith("/") ? path.substring(1) : path;
    int slash = trimmed.indexOf('/');
    return slash < 0 ? trimmed : trimmed.substring(0, slash);
  }

  private static String queryParameter(String query, String name) {
    if (query == null) {
      return null;
    }
    for (String pair : query.split("&")) {
      int eq = pair.indexOf('=');
      if (eq > 0 && pair.substring(0, eq).equals(name)) {
        return pair.substring(eq + 1);
      }
    }
    return null;
  }
}
