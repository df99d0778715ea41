package com.scholary.typesetter.content;

public enum BlockKind {
  CHAPTER,
  SUBCHAPTER
}
