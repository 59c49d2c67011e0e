package com.scholary.transcripthub.summary;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcripthub.exception.TranscriptParseException;
import com.scholary.transcripthub.provider.gemini.GeminiClient;
import com.scholary.transcripthub.segment.Segment;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Summarizes with Gemini, asking for JSON with an overview and timestamped points. */
@Component
public class GeminiSummarizer implements Summarizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeminiSummarizer.class);

  static final String SYSTEM_INSTRUCTION =
      "You are an assistant specialized in summarizing transcribed content.\n"
          + "Write the summary in the same language as the transcript.\n"
          + "Respond with JSON of the form\n"
          + "{\"summary_points\": [{\"text\": \"First main point\", \"timestamp\": 45.2}],"
          + " \"overview\": \"Overall summary of the content.\"}\n"
          + "'timestamp' is the number of seconds where the point appears in the transcript,"
          + " given as a number.";

  private final GeminiClient client;
  private final ObjectMapper objectMapper;

  public GeminiSummarizer(GeminiClient client, ObjectMapper objectMapper) {
    this.client = client;
    this.objectMapper = objectMapper;
  }

  @Override
  public SummaryContent summarize(List<Segment> segments) {
    LOGGER.info("Summarizing transcript of {} segments", segments.size());
    return parse(client.generate(SYSTEM_INSTRUCTION, prompt(segments)));
  }

  static String prompt(List<Segment> segments) {
    StringBuilder prompt = new StringBuilder("Summarize the following transcript:\n\n");
    for (Segment segment : segments) {
      prompt.append(String.format(Locale.ROOT, "[%.2fs] ", segment.start()));
      if (segment.speaker() != null) {
        prompt.append(segment.speaker()).append(": ");
      }
      prompt.append(segment.text()).append('\n');
    }
    return prompt.toString();
  }

  SummaryContent parse(String text) {
    JsonNode root;
    try {
      root = objectMapper.readTree(GeminiClient.stripCodeFence(text));
    } catch (JsonProcessingException e) {
      throw new TranscriptParseException(
          GeminiClient.NAME, "Summary is not valid JSON: " + e.getOriginalMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new TranscriptParseException(GeminiClient.NAME, "Summary is not a JSON object");
    }

    List<SummaryPoint> points = new ArrayList<>();
    for (JsonNode point : root.path("summary_points")) {
      JsonNode timestamp = point.get("timestamp");
      if (timestamp == null || !timestamp.isNumber()) {
        throw new TranscriptParseException(
            GeminiClient.NAME, "Summary point without numeric timestamp: " + point);
      }
      points.add(new SummaryPoint(point.path("text").asText(""), timestamp.asDouble()));
    }
    return new SummaryContent(root.path("overview").asText(""), points);
  }
}
