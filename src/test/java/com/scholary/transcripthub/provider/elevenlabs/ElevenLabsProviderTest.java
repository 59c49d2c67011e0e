package com.scholary.transcripthub.provider.elevenlabs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcripthub.exception.ProviderException;
import com.scholary.transcripthub.exception.TranscriptParseException;
import com.scholary.transcripthub.provider.ProviderHttpClient;
import com.scholary.transcripthub.provider.ProviderResult;
import com.scholary.transcripthub.provider.RecognitionResult;
import com.scholary.transcripthub.segment.Segment;
import com.scholary.transcripthub.segment.SegmentBuilder;
import com.scholary.transcripthub.segment.Word;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ElevenLabsProviderTest {

  private static final String RESPONSE =
      "{\"language_code\": \"eng\", \"words\": ["
          + "{\"text\": \"Hello\", \"start\": 0.0, \"end\": 0.4, \"type\": \"word\","
          + " \"speaker_id\": \"speaker_0\", \"logprob\": -0.1},"
          + "{\"text\": \" \", \"start\": 0.4, \"end\": 0.5, \"type\": \"spacing\","
          + " \"speaker_id\": \"speaker_0\"},"
          + "{\"text\": \"there.\", \"start\": 0.5, \"end\": 0.9, \"type\": \"word\","
          + " \"speaker_id\": \"speaker_0\", \"logprob\": 0.0},"
          + "{\"text\": \" \", \"start\": 0.9, \"end\": 1.0, \"type\": \"spacing\","
          + " \"speaker_id\": \"speaker_1\"},"
          + "{\"text\": \"Hi!\", \"start\": 1.0, \"end\": 1.3, \"type\": \"word\","
          + " \"speaker_id\": \"speaker_1\"}"
          + "]}";

  @Mock private ProviderHttpClient httpClient;

  @TempDir Path tempDir;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private Path audio;

  @BeforeEach
  void setUp() throws IOException {
    audio = tempDir.resolve("clip.mp3");
    Files.write(audio, new byte[] {1, 2, 3});
  }

  @Test
  void transcribe_shouldPostAudioWithApiKeyAndParseSpeakerRuns() {
    when(httpClient.request(any(URI.class)))
        .thenAnswer(invocation -> HttpRequest.newBuilder((URI) invocation.getArgument(0)));
    when(httpClient.send(any(HttpRequest.class))).thenReturn(RESPONSE);

    ProviderResult result = provider("secret").transcribe(audio, "en");

    assertThat(result.isSuccess()).isTrue();
    RecognitionResult recognition = result.recognition();
    assertThat(recognition.detectedLanguage()).isEqualTo("eng");
    assertThat(recognition.segments())
        .extracting(Segment::speaker)
        .containsExactly("speaker_0", "speaker_1");
    assertThat(recognition.segments().get(0).text()).isEqualTo("Hello there.");

    ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(request.capture());
    assertThat(request.getValue().uri().toString())
        .isEqualTo("https://api.elevenlabs.test/v1/speech-to-text");
    assertThat(request.getValue().headers().firstValue("xi-api-key")).contains("secret");
    assertThat(request.getValue().headers().firstValue("Content-Type").orElseThrow())
        .startsWith("multipart/form-data; boundary=");
  }

  @Test
  void transcribe_shouldFailWithoutApiKey() {
    ProviderResult result = provider("").transcribe(audio, "en");

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.error().getProvider()).isEqualTo("elevenlabs");
    verifyNoInteractions(httpClient);
  }

  @Test
  void transcribe_shouldReturnUpstreamFailure() {
    ProviderException upstream = new ProviderException("elevenlabs", "status 401");
    when(httpClient.request(any(URI.class)))
        .thenAnswer(invocation -> HttpRequest.newBuilder((URI) invocation.getArgument(0)));
    when(httpClient.send(any(HttpRequest.class))).thenThrow(upstream);

    ProviderResult result = provider("secret").transcribe(audio, null);

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.error()).isSameAs(upstream);
  }

  @Test
  void languageCode_shouldMapToThreeLetterCodes() {
    assertThat(ElevenLabsProvider.languageCode("en")).isEqualTo("eng");
    assertThat(ElevenLabsProvider.languageCode("VI")).isEqualTo("vie");
    assertThat(ElevenLabsProvider.languageCode("sv")).isEqualTo("sv");
    assertThat(ElevenLabsProvider.languageCode("auto")).isNull();
    assertThat(ElevenLabsProvider.languageCode(null)).isNull();
  }

  @Test
  void parse_shouldKeepSpacingTokensAndConvertLogprob() {
    RecognitionResult result = new ElevenLabsResponseParser(objectMapper).parse(RESPONSE);

    List<Word> firstRun = result.segments().get(0).words();
    assertThat(firstRun).extracting(Word::spacing).containsExactly(false, true, false, true);
    assertThat(firstRun.get(0).confidence()).isCloseTo(Math.exp(-0.1), within(1e-9));
    assertThat(result.segments().get(1).words().get(0).confidence())
        .isEqualTo(ElevenLabsResponseParser.DEFAULT_CONFIDENCE);
  }

  @Test
  void parse_shouldFeedSegmentBuilder() {
    RecognitionResult result = new ElevenLabsResponseParser(objectMapper).parse(RESPONSE);

    List<Segment> segments = new SegmentBuilder(200).rebuild(result.segments());

    assertThat(segments).extracting(Segment::text).containsExactly("Hello there.", "Hi!");
    assertThat(segments.get(1).start()).isEqualTo(1.0);
  }

  @Test
  void parse_shouldRejectMalformedResponses() {
    ElevenLabsResponseParser parser = new ElevenLabsResponseParser(objectMapper);

    assertThatThrownBy(() -> parser.parse("not json"))
        .isInstanceOf(TranscriptParseException.class);
    assertThatThrownBy(() -> parser.parse("{\"words\": {}}"))
        .isInstanceOf(TranscriptParseException.class);
    assertThatThrownBy(() -> parser.parse("{\"words\": [{\"text\": \"hi\", \"end\": 1.0}]}"))
        .isInstanceOf(TranscriptParseException.class)
        .hasMessageContaining("start");
  }

  @Test
  void parse_shouldAcceptEmptyTranscript() {
    RecognitionResult result =
        new ElevenLabsResponseParser(objectMapper).parse("{\"language_code\": \"eng\"}");

    assertThat(result.segments()).isEmpty();
  }

  private ElevenLabsProvider provider(String apiKey) {
    ElevenLabsProperties properties =
        new ElevenLabsProperties("https://api.elevenlabs.test", apiKey, "scribe_v1", 5, 30, 2);
    return new ElevenLabsProvider(properties, httpClient, objectMapper);
  }
}
