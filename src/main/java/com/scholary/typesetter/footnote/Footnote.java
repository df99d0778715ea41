package com.scholary.typesetter.footnote;

/**
 * A footnote with its book-wide number.
 *
 * @param number 1-based global number, assigned in first-seen document order
 * @param content footnote text
 */
public record Footnote(int number, String content) {

  public Footnote {
    if (number < 1) {
      throw new IllegalArgumentException("Footnote number must be >= 1: " + number);
    }
    if (content == null || content.isBlank()) {
      throw new IllegalArgumentException("Footnote content must not be blank");
    }
  }
}
