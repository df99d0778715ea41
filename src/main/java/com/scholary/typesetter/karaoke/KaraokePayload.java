package com.scholary.typesetter.karaoke;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** JSON payload carried in a karaoke block's {@code data-karaoke} attribute. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KaraokePayload(
    String type, String text, String audioUrl, List<WordTiming> wordTimings) {

  public KaraokePayload {
    wordTimings = wordTimings == null ? List.of() : List.copyOf(wordTimings);
  }
}
