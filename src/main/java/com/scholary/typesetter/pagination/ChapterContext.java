package com.scholary.typesetter.pagination;

import com.scholary.typesetter.content.ChapterRecord;
import java.util.Map;
import java.util.Optional;

/**
 * Per-chapter facts that stay fixed while the chapter is paginated.
 *
 * @param chapter the chapter record
 * @param chapterIndex index written to every page of the chapter
 * @param backgroundVideos background video sources keyed by 1-based page number
 */
public record ChapterContext(
    ChapterRecord chapter, int chapterIndex, Map<Integer, String> backgroundVideos) {

  public ChapterContext {
    backgroundVideos = backgroundVideos == null ? Map.of() : Map.copyOf(backgroundVideos);
  }

  /** -2 for the standalone first page, -1 for the cover, otherwise the order or list position. */
  public static int chapterIndexOf(ChapterRecord chapter, int position) {
    if (chapter.firstPage()) {
      return -2;
    }
    if (chapter.cover()) {
      return -1;
    }
    return chapter.order() != null ? chapter.order() : position;
  }

  public Optional<String> backgroundVideoFor(int pageIndex) {
    return Optional.ofNullable(backgroundVideos.get(pageIndex + 1));
  }
}
