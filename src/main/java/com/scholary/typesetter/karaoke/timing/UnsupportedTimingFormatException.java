package com.scholary.typesetter.karaoke.timing;

/** Thrown when a timing file is malformed or in a format that cannot be read. */
public class UnsupportedTimingFormatException extends RuntimeException {

  public UnsupportedTimingFormatException(String message) {
    super(message);
  }

  public UnsupportedTimingFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
