package com.scholary.typesetter.split;

/**
 * Outcome of splitting an element against a height budget.
 *
 * @param first HTML of the part that fits, null when nothing fits
 * @param second HTML of the remainder, null when everything fits
 * @param firstCharCount characters of the element's text placed in {@code first}
 * @param boundary kind of boundary used
 */
public record SplitResult(String first, String second, int firstCharCount, SplitBoundary boundary) {

  public SplitResult {
    if (firstCharCount < 0) {
      throw new IllegalArgumentException("firstCharCount must not be negative: " + firstCharCount);
    }
    if (first == null && second == null) {
      throw new IllegalArgumentException("A split must keep at least one part");
    }
  }

  public static SplitResult whole(String html, int length) {
    return new SplitResult(html, null, length, SplitBoundary.WHOLE);
  }

  public static SplitResult nothingFits(String html) {
    return new SplitResult(null, html, 0, SplitBoundary.NONE);
  }

  public boolean hasFirst() {
    return first != null;
  }

  public boolean hasSecond() {
    return second != null;
  }
}
