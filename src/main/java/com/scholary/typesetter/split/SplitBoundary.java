package com.scholary.typesetter.split;

/** Where a split landed. */
public enum SplitBoundary {
  /** The whole element fits; nothing was split. */
  WHOLE,
  SENTENCE,
  WORD,
  /** No safe boundary fits; the whole element goes to the second part. */
  NONE
}
