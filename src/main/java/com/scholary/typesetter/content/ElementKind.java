package com.scholary.typesetter.content;

/** Kinds of top-level content elements. Only paragraphs may be split across pages. */
public enum ElementKind {
  HEADING(true),
  IMAGE(true),
  VIDEO(true),
  POETRY(true),
  DINKUS(true),
  KARAOKE_BLOCK(true),
  FIELD_NOTES(true),
  PARAGRAPH(false);

  private final boolean atomic;

  ElementKind(boolean atomic) {
    this.atomic = atomic;
  }

  public boolean isAtomic() {
    return atomic;
  }
}
