package com.scholary.typesetter.karaoke;

/**
 * Half-open character range of a karaoke source placed on one page.
 *
 * @param karaokeId source id
 * @param startChar first character index
 * @param endChar index after the last character
 */
public record KaraokeSlice(String karaokeId, int startChar, int endChar) {

  public KaraokeSlice {
    if (karaokeId == null || karaokeId.isBlank()) {
      throw new IllegalArgumentException("karaokeId must not be blank");
    }
    if (startChar < 0 || endChar <= startChar) {
      throw new IllegalArgumentException(
          String.format("Slice must be a non-empty range: [%d, %d)", startChar, endChar));
    }
  }

  public boolean contains(int charIndex) {
    return charIndex >= startChar && charIndex < endChar;
  }

  public int length() {
    return endChar - startChar;
  }
}
