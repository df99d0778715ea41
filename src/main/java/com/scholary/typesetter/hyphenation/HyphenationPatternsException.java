package com.scholary.typesetter.hyphenation;

/** Thrown when compiled hyphenation patterns cannot be read from the classpath. */
public class HyphenationPatternsException extends RuntimeException {

  public HyphenationPatternsException(String message) {
    super(message);
  }

  public HyphenationPatternsException(String message, Throwable cause) {
    super(message, cause);
  }
}
