package com.scholary.transcripthub.youtube;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.transcripthub.exception.ValidationException;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class YouTubeUrlParserTest {

  @ParameterizedTest
  @ValueSource(
      strings = {
        "https://www.youtube.com/watch?v=dQw4w9WgXcQ",
        "https://youtube.com/watch?feature=share&v=dQw4w9WgXcQ&t=42",
        "https://m.youtube.com/watch?v=dQw4w9WgXcQ",
        "https://youtu.be/dQw4w9WgXcQ?si=abc",
        "https://www.youtube.com/shorts/dQw4w9WgXcQ",
        "https://www.youtube.com/embed/dQw4w9WgXcQ",
        "https://www.youtube.com/live/dQw4w9WgXcQ?feature=shared",
        "  https://youtu.be/dQw4w9WgXcQ  "
      })
  void videoId_shouldExtractIdFromSupportedShapes(String url) {
    assertThat(YouTubeUrlParser.videoId(url)).isEqualTo("dQw4w9WgXcQ");
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "",
        "https://vimeo.com/123456789",
        "https://www.youtube.com/watch?list=PL123",
        "https://www.youtube.com/watch?v=short",
        "https://www.youtube.com/channel/UC1234567890",
        "https://notyoutube.com/watch?v=dQw4w9WgXcQ",
        "not a url at all"
      })
  void videoId_shouldRejectOtherUrls(String url) {
    assertThatThrownBy(() -> YouTubeUrlParser.videoId(url))
        .isInstanceOf(ValidationException.class);
  }
}
