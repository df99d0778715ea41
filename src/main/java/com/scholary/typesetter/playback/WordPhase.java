package com.scholary.typesetter.playback;

/** Highlight phase of one word relative to the playhead. */
public enum WordPhase {
  PENDING,
  ACTIVE,
  COMPLETE
}
