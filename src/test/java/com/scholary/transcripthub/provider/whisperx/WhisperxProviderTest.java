package com.scholary.transcripthub.provider.whisperx;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcripthub.exception.TranscriptParseException;
import com.scholary.transcripthub.provider.ProviderHttpClient;
import com.scholary.transcripthub.provider.RecognitionResult;
import com.scholary.transcripthub.segment.Segment;
import com.scholary.transcripthub.segment.Word;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WhisperxProviderTest {

  private WhisperxProvider provider;

  @BeforeEach
  void setUp() {
    provider =
        new WhisperxProvider(
            new WhisperxProperties("http://localhost:9001", 5, 60, 1),
            mock(ProviderHttpClient.class),
            new ObjectMapper());
  }

  @Test
  void parse_shouldMapSegmentsAndFillUnalignedWords() {
    String body =
        "{\"language\": \"en\", \"model\": \"large-v3\", \"segments\": ["
            + "{\"start\": 0.0, \"end\": 2.0, \"text\": \" It costs 10 dollars.\","
            + " \"speaker\": \"SPEAKER_00\", \"words\": ["
            + "{\"word\": \"It\", \"start\": 0.0, \"end\": 0.3, \"score\": 0.9,"
            + " \"speaker\": \"SPEAKER_00\"},"
            + "{\"word\": \"costs\", \"start\": 0.3, \"end\": 0.7, \"score\": 0.8},"
            + "{\"word\": \"10\"},"
            + "{\"word\": \"dollars.\", \"start\": 1.2, \"end\": 2.0, \"score\": 0.7}]},"
            + "{\"start\": 2.5, \"end\": 3.0, \"text\": \"Yes.\", \"speaker\": \"SPEAKER_01\"}"
            + "]}";

    RecognitionResult result = provider.parse(body);

    assertThat(result.detectedLanguage()).isEqualTo("en");
    assertThat(result.segments()).hasSize(2);
    Segment first = result.segments().get(0);
    assertThat(first.words())
        .extracting(Word::text)
        .containsExactly("It", "costs", "10", "dollars.");
    Word unaligned = first.words().get(2);
    assertThat(unaligned.start()).isEqualTo(0.7);
    assertThat(unaligned.end()).isEqualTo(0.7);
    assertThat(unaligned.speaker()).isEqualTo("SPEAKER_00");
    assertThat(result.segments().get(1).words()).isEmpty();
  }

  @Test
  void parse_shouldRejectResponsesWithoutSegments() {
    assertThatThrownBy(() -> provider.parse("{\"language\": \"en\"}"))
        .isInstanceOf(TranscriptParseException.class);
    assertThatThrownBy(() -> provider.parse("[1, 2]"))
        .isInstanceOf(TranscriptParseException.class);
    assertThatThrownBy(() -> provider.parse("{\"segments\": [{\"text\": \"no timings\"}]}"))
        .isInstanceOf(TranscriptParseException.class);
  }
}
