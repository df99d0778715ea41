package com.scholary.typesetter.karaoke;

/** The page flow a karaoke source is sliced into. */
public interface SliceTarget {

  /** Whether the page being filled has no content yet. */
  boolean isEmpty();

  /** Content height still free on the page being filled, with the karaoke bottom reserve. */
  double remainingHeight();

  /** Append a slice to the page being filled. */
  void place(KaraokeSlice slice, String html);

  /** Emit the page being filled and continue on a fresh page. */
  void breakPage();
}
