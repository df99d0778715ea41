package com.scholary.typesetter.playback;

/** Runs a callback once per animation frame until cancelled. */
@FunctionalInterface
public interface FrameScheduler {

  FrameLoop start(Runnable frame);

  /** A running frame loop. */
  @FunctionalInterface
  interface FrameLoop {

    /** Stop the loop. A frame already running completes. */
    void cancel();
  }
}
