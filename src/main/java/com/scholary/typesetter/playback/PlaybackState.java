package com.scholary.typesetter.playback;

import com.scholary.typesetter.karaoke.KaraokeSlice;

/**
 * Snapshot of a controller's playback state.
 *
 * @param currentSlice slice being played, null when idle
 * @param resumeWordIndex word playback resumes at on the next page
 * @param resumeTime audio time playback resumes at on the next page
 * @param waitingForNextPage whether playback paused at the end of a slice that is not the last
 * @param playing whether audio is playing
 */
public record PlaybackState(
    KaraokeSlice currentSlice,
    Integer resumeWordIndex,
    Double resumeTime,
    boolean waitingForNextPage,
    boolean playing) {

  public boolean hasResumePoint() {
    return resumeWordIndex != null && resumeTime != null;
  }
}
