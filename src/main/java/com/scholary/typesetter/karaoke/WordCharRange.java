package com.scholary.typesetter.karaoke;

/**
 * A timed word located in the source text.
 *
 * @param word word as given by the timing data
 * @param start word start time in seconds
 * @param end word end time in seconds
 * @param charStart first character index in the source text
 * @param charEnd index after the last character
 * @param wordIndex position of the word in the timing data
 */
public record WordCharRange(
    String word, double start, double end, int charStart, int charEnd, int wordIndex) {

  public WordCharRange {
    if (charStart < 0 || charEnd <= charStart) {
      throw new IllegalArgumentException(
          String.format("Invalid character range [%d, %d) for word %s", charStart, charEnd, word));
    }
  }

  /** Whether the word overlaps the half-open character range. */
  public boolean overlaps(int rangeStart, int rangeEnd) {
    return charStart < rangeEnd && charEnd > rangeStart;
  }
}
