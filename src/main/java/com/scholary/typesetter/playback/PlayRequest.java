package com.scholary.typesetter.playback;

/**
 * Where playback of a slice should start.
 *
 * @param resumeWordIndex word to resume at, or null for a fresh start
 * @param resumeTime audio time to resume at, or null for a fresh start
 */
public record PlayRequest(Integer resumeWordIndex, Double resumeTime) {

  public static PlayRequest fresh() {
    return new PlayRequest(null, null);
  }

  public static PlayRequest resume(int wordIndex, double time) {
    return new PlayRequest(wordIndex, time);
  }

  public boolean isResuming() {
    return resumeWordIndex != null || resumeTime != null;
  }
}
