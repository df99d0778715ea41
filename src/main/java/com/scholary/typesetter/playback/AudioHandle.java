package com.scholary.typesetter.playback;

/** Playback of one karaoke source's audio track. */
public interface AudioHandle {

  void play();

  void pause();

  /** Move the playhead, in seconds. */
  void seek(double seconds);

  /** Playhead position in seconds. */
  double currentTime();

  boolean isPlaying();

  /** Register a listener called once playback reaches the end of the track. */
  void onEnded(Runnable listener);

  /** Stop playback and free the track. The handle is unusable afterwards. */
  void release();
}
