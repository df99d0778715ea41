package com.scholary.typesetter.karaoke;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class WordNormalizerTest {

  @Test
  void normalizeWord_stripsDiacriticsAndPunctuation() {
    assertThat(WordNormalizer.normalizeWord("Caf\u00e9!")).isEqualTo("cafe");
    assertThat(WordNormalizer.normalizeWord("Don\u2019t")).isEqualTo("don't");
    assertThat(WordNormalizer.normalizeWord("--")).isEmpty();
    assertThat(WordNormalizer.normalizeWord(null)).isEmpty();
  }

  @Test
  void normalizeText_unifiesApostrophesAndLineEndings() {
    assertThat(WordNormalizer.normalizeText("it\u2019s\r\nna\u00ADme")).isEqualTo("it's\nname");
  }

  @Test
  void tokenize_reportsOffsets() {
    List<WordNormalizer.Token> tokens = WordNormalizer.tokenize("Hello, world");

    assertThat(tokens).hasSize(2);
    assertThat(tokens.get(0).start()).isZero();
    assertThat(tokens.get(0).end()).isEqualTo(5);
    assertThat(tokens.get(1).start()).isEqualTo(7);
    assertThat(tokens.get(1).normalized()).isEqualTo("world");
  }
}
