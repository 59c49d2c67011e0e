package com.scholary.transcripthub.segment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SegmentBuilderTest {

  private SegmentBuilder builder;

  @BeforeEach
  void setUp() {
    builder = new SegmentBuilder(200);
  }

  @Test
  void build_shouldMergeOneSpeakersSentencesIntoOneSegment() {
    List<Word> tokens = words("A", 0.0, "Hello", "world.", "How", "are", "you?");

    List<Segment> segments = builder.build(tokens);

    assertThat(segments).hasSize(1);
    Segment segment = segments.get(0);
    assertThat(segment.text()).isEqualTo("Hello world. How are you?");
    assertThat(segment.speaker()).isEqualTo("A");
    assertThat(segment.start()).isEqualTo(0.0);
    assertThat(segment.end()).isEqualTo(5.0);
    assertThat(segment.words()).hasSize(5);
  }

  @Test
  void build_shouldSplitOnSpeakerChange() {
    List<Word> tokens = new ArrayList<>(words("A", 0.0, "Hi", "there."));
    tokens.addAll(words("B", 2.0, "Hello."));
    tokens.addAll(words("A", 3.0, "Bye"));

    List<Segment> segments = builder.build(tokens);

    assertThat(segments).extracting(Segment::speaker).containsExactly("A", "B", "A");
    assertThat(segments).extracting(Segment::text).containsExactly("Hi there.", "Hello.", "Bye");
    for (Segment segment : segments) {
      assertThat(segment.words()).allMatch(w -> w.speaker().equals(segment.speaker()));
    }
  }

  @Test
  void build_shouldBudgetSentenceCutShortBySpeakerChangeLikeAnyOther() {
    builder = new SegmentBuilder(20);
    List<Word> tokens = new ArrayList<>(words("A", 0.0, "One", "two", "three."));
    tokens.addAll(words("A", 3.0, "Four", "five"));
    tokens.addAll(words("B", 5.0, "Bye."));

    List<Segment> segments = builder.build(tokens);

    assertThat(segments)
        .extracting(Segment::text)
        .containsExactly("One two three.", "Four five", "Bye.");
    assertThat(segments).extracting(Segment::speaker).containsExactly("A", "A", "B");
    assertThat(segments.get(1).start()).isEqualTo(3.0);
  }

  @Test
  void build_shouldSplitMidSentenceWhenSpeakerChanges() {
    List<Word> tokens = new ArrayList<>(words("A", 0.0, "So", "what"));
    tokens.addAll(words("B", 2.0, "exactly?"));

    List<Segment> segments = builder.build(tokens);

    assertThat(segments).extracting(Segment::text).containsExactly("So what", "exactly?");
  }

  @Test
  void build_shouldKeepSegmentsWithinMaxLength() {
    SegmentBuilder shortBuilder = new SegmentBuilder(20);
    List<Word> tokens = words("A", 0.0, "One", "two", "three.", "Four", "five.", "Six.");

    List<Segment> segments = shortBuilder.build(tokens);

    assertThat(segments)
        .extracting(Segment::text)
        .containsExactly("One two three.", "Four five. Six.");
    assertThat(segments).allMatch(s -> s.text().length() <= 20);
  }

  @Test
  void build_shouldEmitOverlongSentenceOnItsOwn() {
    SegmentBuilder shortBuilder = new SegmentBuilder(10);
    List<Word> tokens = words("A", 0.0, "Hi.", "Extraordinarily", "long", "sentence.", "Ok.");

    List<Segment> segments = shortBuilder.build(tokens);

    assertThat(segments)
        .extracting(Segment::text)
        .containsExactly("Hi.", "Extraordinarily long sentence.", "Ok.");
  }

  @Test
  void build_shouldUseSpacingTokensForTextButNotWords() {
    List<Word> tokens =
        List.of(
            Word.content(0.0, 0.5, "Hello", "A", 0.9),
            Word.spacing(0.5, 0.6, " ", "A"),
            Word.content(0.6, 1.0, "world.", "A", 0.8));

    List<Segment> segments = builder.build(tokens);

    assertThat(segments).hasSize(1);
    assertThat(segments.get(0).text()).isEqualTo("Hello world.");
    assertThat(segments.get(0).words()).extracting(Word::text).containsExactly("Hello", "world.");
  }

  @Test
  void build_shouldReturnEmptyForEmptyInput() {
    assertThat(builder.build(List.of())).isEmpty();
  }

  @Test
  void build_shouldKeepStartsNonDecreasing() {
    List<Word> tokens = new ArrayList<>();
    for (int i = 0; i < 40; i++) {
      String speaker = (i / 7) % 2 == 0 ? "A" : "B";
      tokens.add(Word.content(i, i + 1, i % 3 == 2 ? "word." : "word", speaker, 1.0));
    }

    List<Segment> segments = new SegmentBuilder(25).build(tokens);

    for (int i = 1; i < segments.size(); i++) {
      assertThat(segments.get(i).start()).isGreaterThanOrEqualTo(segments.get(i - 1).start());
    }
    int wordCount = segments.stream().mapToInt(s -> s.words().size()).sum();
    assertThat(wordCount).isEqualTo(40);
  }

  @Test
  void rebuild_shouldPreserveWordsAndText() {
    List<Segment> raw =
        List.of(
            new Segment(0.0, 2.0, "Good morning.", "A", words("A", 0.0, "Good", "morning.")),
            new Segment(2.0, 4.0, "How are", "A", words("A", 2.0, "How", "are")),
            new Segment(4.0, 5.0, "you?", "A", words("A", 4.0, "you?")));

    List<Segment> rebuilt = builder.rebuild(raw);

    String original = raw.stream().map(Segment::text).collect(Collectors.joining(" "));
    String reconstructed = rebuilt.stream().map(Segment::text).collect(Collectors.joining(" "));
    assertThat(reconstructed).isEqualTo(original);
    assertThat(rebuilt).hasSize(1);
  }

  @Test
  void rebuild_shouldTreatWordlessSegmentsAsSingleTokens() {
    List<Segment> raw =
        List.of(
            new Segment(0.0, 1.5, "Good morning.", "A", List.of()),
            new Segment(1.5, 3.0, "   ", "A", List.of()),
            new Segment(3.0, 4.0, "Hello.", "B", List.of()));

    List<Segment> rebuilt = builder.rebuild(raw);

    assertThat(rebuilt).extracting(Segment::text).containsExactly("Good morning.", "Hello.");
    assertThat(rebuilt.get(0).end()).isEqualTo(1.5);
    assertThat(rebuilt.get(1).start()).isEqualTo(3.0);
  }

  @Test
  void endsSentence_shouldRecognizeTerminalPunctuation() {
    assertThat(SegmentBuilder.endsSentence("done.")).isTrue();
    assertThat(SegmentBuilder.endsSentence("really?")).isTrue();
    assertThat(SegmentBuilder.endsSentence("wow! ")).isTrue();
    assertThat(SegmentBuilder.endsSentence("and,")).isFalse();
  }

  @Test
  void constructor_shouldRejectNonPositiveLength() {
    assertThatThrownBy(() -> new SegmentBuilder(0)).isInstanceOf(IllegalArgumentException.class);
  }

  private static List<Word> words(String speaker, double start, String... texts) {
    List<Word> words = new ArrayList<>();
    double t = start;
    for (String text : texts) {
      words.add(Word.content(t, t + 1.0, text, speaker, 1.0));
      t += 1.0;
    }
    return words;
  }
}
