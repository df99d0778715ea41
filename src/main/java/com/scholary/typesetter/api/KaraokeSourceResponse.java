package com.scholary.typesetter.api;

import com.scholary.typesetter.karaoke.KaraokeSource;
import com.scholary.typesetter.karaoke.LetterTiming;
import com.scholary.typesetter.karaoke.WordCharRange;
import java.util.List;

/** Karaoke text and timing as needed to wire up playback. */
public record KaraokeSourceResponse(
    String id,
    String text,
    String audioUrl,
    List<LetterTiming> letterTimings,
    List<WordCharRange> wordCharRanges) {

  public static KaraokeSourceResponse from(KaraokeSource source) {
    return new KaraokeSourceResponse(
        source.id(),
        source.text(),
        source.audioUrl(),
        source.letterTimings(),
        source.wordCharRanges());
  }
}
