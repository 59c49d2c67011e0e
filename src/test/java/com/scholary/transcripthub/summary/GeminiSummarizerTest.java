package com.scholary.transcripthub.summary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcripthub.exception.TranscriptParseException;
import com.scholary.transcripthub.provider.gemini.GeminiClient;
import com.scholary.transcripthub.segment.Segment;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GeminiSummarizerTest {

  @Mock private GeminiClient client;

  @Test
  void summarize_shouldParseFencedJson() {
    when(client.generate(eq(GeminiSummarizer.SYSTEM_INSTRUCTION), anyString()))
        .thenReturn(
            "```json\n{\"summary_points\": [{\"text\": \"Greeting\", \"timestamp\": 1.5},"
                + " {\"text\": \"Farewell\", \"timestamp\": 42}],"
                + " \"overview\": \"A short chat.\"}\n```");

    SummaryContent content =
        new GeminiSummarizer(client, new ObjectMapper())
            .summarize(List.of(new Segment(1.5, 2.0, "Hello.", "A", null)));

    assertThat(content.overview()).isEqualTo("A short chat.");
    assertThat(content.points())
        .containsExactly(new SummaryPoint("Greeting", 1.5), new SummaryPoint("Farewell", 42.0));
  }

  @Test
  void parse_shouldRejectTextualTimestamp() {
    GeminiSummarizer summarizer = new GeminiSummarizer(client, new ObjectMapper());

    assertThatThrownBy(
            () ->
                summarizer.parse(
                    "{\"summary_points\": [{\"text\": \"x\", \"timestamp\": \"00:45\"}]}"))
        .isInstanceOf(TranscriptParseException.class)
        .hasMessageContaining("numeric timestamp");
  }

  @Test
  void parse_shouldRejectNonJson() {
    GeminiSummarizer summarizer = new GeminiSummarizer(client, new ObjectMapper());

    assertThatThrownBy(() -> summarizer.parse("Here is your summary!"))
        .isInstanceOf(TranscriptParseException.class);
  }

  @Test
  void prompt_shouldListSegmentsWithTimestampsAndSpeakers() {
    String prompt =
        GeminiSummarizer.prompt(
            List.of(
                new Segment(1.5, 3.0, "Hello there.", "A", null),
                new Segment(3.25, 4.0, "Hi.", null, null)));

    assertThat(prompt).contains("[1.50s] A: Hello there.\n").contains("[3.25s] Hi.\n");
  }
}
