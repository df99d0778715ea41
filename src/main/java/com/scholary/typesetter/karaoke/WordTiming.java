package com.scholary.typesetter.karaoke;

/**
 * Timing of one spoken word, in seconds.
 *
 * @param word the word as transcribed
 * @param start start time
 * @param end end time
 */
public record WordTiming(String word, double start, double end) {

  public WordTiming {
    if (word == null) {
      throw new IllegalArgumentException("word must not be null");
    }
    if (start < 0 || end < 0) {
      throw new IllegalArgumentException(
          String.format(
              "Word timing must not be negative: word=%s, start=%.3f, end=%.3f", word, start, end));
    }
  }
}
