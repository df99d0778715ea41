package com.scholary.typesetter.karaoke;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The single text and timing model shared by every slice of one karaoke block.
 *
 * <p>Created once per pagination run and read-only afterwards.
 */
public final class KaraokeSource {

  private final String id;
  private final String text;
  private final String audioUrl;
  private final List<LetterTiming> letterTimings;
  private final List<WordCharRange> wordCharRanges;

  public KaraokeSource(
      String id,
      String text,
      String audioUrl,
      List<LetterTiming> letterTimings,
      List<WordCharRange> wordCharRanges) {
    if (letterTimings.size() != text.length()) {
      throw new IllegalArgumentException(
          String.format(
              "Letter timings must cover every character: text=%d, timings=%d",
              text.length(), letterTimings.size()));
    }
    this.id = id;
    this.text = text;
    this.audioUrl = audioUrl;
    this.letterTimings = Collections.unmodifiableList(new ArrayList<>(letterTimings));
    this.wordCharRanges = List.copyOf(wordCharRanges);
  }

  public String id() {
    return id;
  }

  public String text() {
    return text;
  }

  public String audioUrl() {
    return audioUrl;
  }

  /** One entry per character; untimed characters hold null. */
  public List<LetterTiming> letterTimings() {
    return letterTimings;
  }

  /** Timed words in text order. */
  public List<WordCharRange> wordCharRanges() {
    return wordCharRanges;
  }

  public int length() {
    return text.length();
  }

  public Optional<LetterTiming> letterTiming(int charIndex) {
    if (charIndex < 0 || charIndex >= letterTimings.size()) {
      return Optional.empty();
    }
    return Optional.ofNullable(letterTimings.get(charIndex));
  }

  public Optional<WordCharRange> word(int wordIndex) {
    for (WordCharRange range : wordCharRanges) {
      if (range.wordIndex() == wordIndex) {
        return Optional.of(range);
      }
    }
    return Optional.empty();
  }

  /** Timed words overlapping the half-open character range, in text order. */
  public List<WordCharRange> wordsIn(int startChar, int endChar) {
    List<WordCharRange> words = new ArrayList<>();
    for (WordCharRange range : wordCharRanges) {
      if (range.overlaps(startChar, endChar)) {
        words.add(range);
      }
    }
    return words;
  }
}
