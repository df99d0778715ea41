package com.scholary.typesetter.playback;

/**
 * A timed word inside a slice's markup.
 *
 * @param wordIndex index of the word in the source's timing data
 * @param charStart first character, in source text offsets
 * @param charEnd index after the last character
 * @param start word start time in seconds
 * @param end word end time in seconds
 */
public record SliceWord(int wordIndex, int charStart, int charEnd, double start, double end) {

  /** Fill ratio of the word at a playhead time, clamped to [0, 1]. */
  public double fillAt(double time) {
    double duration = Math.max(end - start, 0.001);
    return Math.min(Math.max((time - start) / duration, 0), 1);
  }

  public WordPhase phaseAt(double time) {
    if (time >= end) {
      return WordPhase.COMPLETE;
    }
    if (time >= start) {
      return WordPhase.ACTIVE;
    }
    return WordPhase.PENDING;
  }
}
