package com.scholary.typesetter.playback;

/** Word markup of a karaoke slice could not be installed within the allowed attempts. */
public class KaraokeSliceInitializationException extends RuntimeException {

  public KaraokeSliceInitializationException(String message) {
    super(message);
  }

  public KaraokeSliceInitializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
