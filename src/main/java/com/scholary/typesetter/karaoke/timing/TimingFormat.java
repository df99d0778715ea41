package com.scholary.typesetter.karaoke.timing;

/** Word timing file formats accepted for karaoke blocks. */
public enum TimingFormat {
  /** JSON array of {@code {word, start, end}} objects. */
  JSON_WORDS,
  /** Karaoke payload object carrying a {@code wordTimings} array. */
  KARAOKE_PAYLOAD,
  /** Speech-to-text response with words under {@code results.channels[0].alternatives[0]}. */
  DEEPGRAM,
  /** Tab-separated {@code start end word} lines as exported by audio label tracks. */
  LABELS
}
