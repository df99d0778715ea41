package com.scholary.typesetter.content;

/**
 * A run of content paginated as one unit: a chapter's own content or one of its subchapters.
 *
 * <p>Blocks exist only during a pagination run.
 */
public record ContentBlock(
    BlockKind kind,
    String title,
    String html,
    Epigraph epigraph,
    String chapterId,
    String subchapterId,
    boolean includeChapterTitle) {

  /** Subchapter title for pages of this block, null for chapter blocks. */
  public String subchapterTitle() {
    return kind == BlockKind.SUBCHAPTER ? title : null;
  }
}
