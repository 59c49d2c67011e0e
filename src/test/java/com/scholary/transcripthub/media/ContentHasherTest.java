package com.scholary.transcripthub.media;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ContentHasherTest {

  @TempDir Path tempDir;

  private final ContentHasher hasher = new ContentHasher();

  @Test
  void sha256_shouldMatchKnownDigest() throws IOException {
    Path file = Files.write(tempDir.resolve("abc.bin"), "abc".getBytes(StandardCharsets.UTF_8));

    assertThat(hasher.sha256(file))
        .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
  }

  @Test
  void sha256_shouldDependOnlyOnContent() throws IOException {
    byte[] bytes = new byte[20_000];
    for (int i = 0; i < bytes.length; i++) {
      bytes[i] = (byte) (i % 251);
    }
    Path first = Files.write(tempDir.resolve("first.mp3"), bytes);
    Path second = Files.write(tempDir.resolve("renamed.wav"), bytes);
    bytes[19_999] ^= 1;
    Path changed = Files.write(tempDir.resolve("changed.mp3"), bytes);

    assertThat(hasher.sha256(first)).isEqualTo(hasher.sha256(second)).hasSize(64);
    assertThat(hasher.sha256(changed)).isNotEqualTo(hasher.sha256(first));
  }
}
