package com.scholary.transcripthub.provider;

import com.scholary.transcripthub.exception.ProviderException;
import com.scholary.transcripthub.segment.Segment;
import com.scholary.transcripthub.segment.Word;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/** Test provider that plays back queued results, then succeeds with a fixed transcript. */
public class ScriptedProvider implements TranscriptionProvider {

  private final String name;
  private final Deque<ProviderResult> script = new ArrayDeque<>();
  private final List<Path> audioPaths = new ArrayList<>();
  private final List<Boolean> audioExisted = new ArrayList<>();
  private final List<String> languages = new ArrayList<>();

  public ScriptedProvider(String name) {
    this.name = name;
  }

  public static ProviderResult transcript(String speaker, String... words) {
    List<Word> tokens = new ArrayList<>();
    double t = 0.0;
    for (String word : words) {
      tokens.add(Word.content(t, t + 0.5, word, speaker, 0.9));
      t += 0.5;
    }
    Segment raw = new Segment(0.0, t, String.join(" ", words), speaker, tokens);
    return ProviderResult.success(new RecognitionResult(List.of(raw), "en"));
  }

  public ScriptedProvider thenReturn(ProviderResult... results) {
    script.addAll(Arrays.asList(results));
    return this;
  }

  public ScriptedProvider thenFail(String message) {
    script.add(ProviderResult.failure(new ProviderException(name, message)));
    return this;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public synchronized ProviderResult transcribe(Path audio, String language) {
    audioPaths.add(audio);
    audioExisted.add(Files.exists(audio));
    languages.add(language);
    ProviderResult next = script.poll();
    return next != null ? next : transcript("A", "Hello", "world.");
  }

  public synchronized int calls() {
    return audioPaths.size();
  }

  public synchronized List<Path> audioPaths() {
    return new ArrayList<>(audioPaths);
  }

  public synchronized List<Boolean> audioExisted() {
    return new ArrayList<>(audioExisted);
  }

  public synchronized List<String> languages() {
    return new ArrayList<>(languages);
  }
}
