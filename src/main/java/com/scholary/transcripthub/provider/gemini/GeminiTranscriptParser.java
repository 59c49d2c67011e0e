package com.scholary.transcripthub.provider.gemini;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcripthub.exception.TranscriptParseException;
import com.scholary.transcripthub.provider.RecognitionResult;
import com.scholary.transcripthub.segment.Segment;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the JSON transcript the model is instructed to produce:
 *
 * <pre>
 * {"segments": [{"start": "00:01.250", "end": "00:04.100", "text": "...", "speaker": "Speaker 1"}],
 *  "language": "en"}
 * </pre>
 */
class GeminiTranscriptParser {

  private static final Pattern TIMESTAMP = Pattern.compile("(\\d+):(\\d{1,2})(?:\\.(\\d{1,3}))?");

  private final ObjectMapper objectMapper;

  GeminiTranscriptParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  RecognitionResult parse(String text) {
    JsonNode root;
    try {
      root = objectMapper.readTree(GeminiClient.stripCodeFence(text));
    } catch (JsonProcessingException e) {
      throw new TranscriptParseException(
          GeminiClient.NAME, "Transcript is not valid JSON: " + e.getOriginalMessage(), e);
    }
    JsonNode segmentsNode = root == null ? null : root.get("segments");
    if (segmentsNode == null || !segmentsNode.isArray()) {
      throw new TranscriptParseException(GeminiClient.NAME, "Transcript has no 'segments' array");
    }

    List<Segment> segments = new ArrayList<>();
    for (JsonNode node : segmentsNode) {
      double start = timestamp(node.get("start"));
      double end = timestamp(node.get("end"));
      String speaker = node.path("speaker").asText(null);
      segments.add(new Segment(start, end, node.path("text").asText(""), speaker, List.of()));
    }
    return new RecognitionResult(segments, root.path("language").asText(null));
  }

  /** {@code MM:SS.mmm} to seconds; numeric values are taken as seconds already. */
  static double timestamp(JsonNode node) {
    if (node == null || node.isNull()) {
      throw new TranscriptParseException(GeminiClient.NAME, "Segment without timestamp");
    }
    if (node.isNumber()) {
      return node.asDouble();
    }
    return parseTimestamp(node.asText());
  }

  static double parseTimestamp(String value) {
    Matcher matcher = TIMESTAMP.matcher(value.strip());
    if (!matcher.matches()) {
      throw new TranscriptParseException(
          GeminiClient.NAME, "Invalid timestamp format: " + value);
    }
    int minutes;
    int seconds;
    try {
      minutes = Integer.parseInt(matcher.group(1));
      seconds = Integer.parseInt(matcher.group(2));
    } catch (NumberFormatException e) {
      throw new TranscriptParseException(
          GeminiClient.NAME, "Timestamp out of range: " + value, e);
    }
    String digits = matcher.group(3);
    double fraction = digits == null ? 0.0 : Double.parseDouble("0." + digits);
    return minutes * 60.0 + seconds + fraction;
  }
}
