package com.scholary.typesetter.playback;

import com.scholary.typesetter.karaoke.KaraokeSlice;
import java.util.List;

/** The rendered markup of one karaoke slice on a page, as seen by the playback controller. */
public interface SliceView {

  KaraokeSlice slice();

  /** Whether the markup is still part of a displayed page. */
  boolean isConnected();

  /** Whether per-word markup has been installed and is still present. */
  boolean hasWordMarkup();

  /**
   * Replace the slice text with per-word markup.
   *
   * @return false when the view cannot take the markup yet
   */
  boolean installWordMarkup(String html, List<SliceWord> words);

  void setPlaying(boolean playing);

  void showWord(int wordIndex, WordPhase phase, double fill);

  /** Return every word to the pending state. */
  void resetWords();
}
