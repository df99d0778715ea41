package com.scholary.typesetter.measure;

/** Page sizing mode. */
public enum PageMode {
  /** Page sized to the reader's screen. */
  DEVICE,
  /** Fixed document-sized page, 800x1000 by default. */
  DOCUMENT
}
