package com.scholary.transcripthub.provider.elevenlabs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcripthub.exception.TranscriptParseException;
import com.scholary.transcripthub.provider.RecognitionResult;
import com.scholary.transcripthub.segment.Segment;
import com.scholary.transcripthub.segment.Word;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts a speech-to-text response into raw segments.
 *
 * <p>The response is a flat token list. Each run of tokens from one speaker becomes one raw
 * segment whose word list keeps the spacing tokens, so the segment builder sees the original
 * token stream.
 */
class ElevenLabsResponseParser {

  static final double DEFAULT_CONFIDENCE = 0.5;

  private final ObjectMapper objectMapper;

  ElevenLabsResponseParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  RecognitionResult parse(String body) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new TranscriptParseException(
          ElevenLabsProvider.NAME, "Response is not valid JSON: " + e.getOriginalMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new TranscriptParseException(ElevenLabsProvider.NAME, "Response is not a JSON object");
    }

    JsonNode words = root.path("words");
    if (!words.isMissingNode() && !words.isNull() && !words.isArray()) {
      throw new TranscriptParseException(ElevenLabsProvider.NAME, "'words' is not an array");
    }

    List<Segment> segments = new ArrayList<>();
    List<Word> run = new ArrayList<>();
    String runSpeaker = null;

    for (JsonNode node : words) {
      Word token = toWord(node);
      if (!token.spacing() && !run.isEmpty() && !Objects.equals(token.speaker(), runSpeaker)) {
        segments.add(toSegment(run, runSpeaker));
        run = new ArrayList<>();
      }
      if (!token.spacing()) {
        runSpeaker = token.speaker();
      }
      run.add(token);
    }
    if (!run.isEmpty()) {
      segments.add(toSegment(run, runSpeaker));
    }

    String language = root.path("language_code").asText(null);
    return new RecognitionResult(segments, language);
  }

  private static Word toWord(JsonNode node) {
    JsonNode text = node.get("text");
    if (text == null || !text.isTextual()) {
      throw new TranscriptParseException(ElevenLabsProvider.NAME, "Token without text: " + node);
    }
    double start = requireNumber(node, "start");
    double end = requireNumber(node, "end");
    String speaker = node.path("speaker_id").asText(null);

    if ("spacing".equals(node.path("type").asText())) {
      return Word.spacing(start, end, text.asText(), speaker);
    }
    JsonNode logprob = node.get("logprob");
    double confidence =
        logprob != null && logprob.isNumber() ? Math.exp(logprob.asDouble()) : DEFAULT_CONFIDENCE;
    return Word.content(start, end, text.asText(), speaker, confidence);
  }

  private static double requireNumber(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || !value.isNumber()) {
      throw new TranscriptParseException(
          ElevenLabsProvider.NAME, "Token without numeric '" + field + "': " + node);
    }
    return value.asDouble();
  }

  private static Segment toSegment(List<Word> run, String speaker) {
    StringBuilder text = new StringBuilder();
    for (Word word : run) {
      text.append(word.text());
    }
    return new Segment(
        run.get(0).start(), run.get(run.size() - 1).end(), text.toString().strip(), speaker, run);
  }
}
