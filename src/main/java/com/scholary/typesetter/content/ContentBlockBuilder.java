package com.scholary.typesetter.content;

import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Flattens a chapter into content blocks: the chapter's own content first, then each subchapter
 * that has content, in order.
 */
@Component
public class ContentBlockBuilder {

  public List<ContentBlock> build(ChapterRecord chapter) {
    List<ContentBlock> blocks = new ArrayList<>();
    boolean hasChapterContent = chapter.hasContent();

    if (hasChapterContent) {
      blocks.add(
          new ContentBlock(
              BlockKind.CHAPTER,
              chapter.title(),
              chapter.contentHtml(),
              chapter.epigraph(),
              chapter.id(),
              null,
              false));
    }

    boolean firstSubchapter = true;
    for (ChapterRecord child : chapter.children()) {
      if (!child.hasContent()) {
        continue;
      }
      blocks.add(
          new ContentBlock(
              BlockKind.SUBCHAPTER,
              child.title(),
              child.contentHtml(),
              child.epigraph(),
              chapter.id(),
              child.id(),
              !hasChapterContent && firstSubchapter));
      firstSubchapter = false;
    }
    return blocks;
  }
}
