package com.scholary.typesetter.service;

import com.scholary.typesetter.pagination.Page;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/** Finds the page a saved reading position points to in a freshly paginated book. */
public final class PositionResolver {

  private PositionResolver() {}

  /**
   * Locate the saved page. Falls back to the first page of the same chapter, then the standalone
   * first page, then the cover, then the start of the list.
   */
  public static ResolvedPosition resolve(List<Page> pages, ReadingPosition saved) {
    if (pages.isEmpty()) {
      return ResolvedPosition.START;
    }
    if (saved != null && saved.chapterId() != null) {
      int pageIndex = saved.pageIndex() == null ? 0 : saved.pageIndex();
      Optional<ResolvedPosition> exact =
          find(pages, page -> inChapter(page, saved.chapterId()) && page.pageIndex() == pageIndex);
      if (exact.isPresent()) {
        return exact.get();
      }
      Optional<ResolvedPosition> chapterStart =
          find(pages, page -> inChapter(page, saved.chapterId()) && page.pageIndex() == 0);
      if (chapterStart.isPresent()) {
        return chapterStart.get();
      }
    }
    return find(pages, Page::firstPage)
        .or(() -> find(pages, page -> page.cover() && !page.firstPage()))
        .orElseGet(() -> at(pages, 0));
  }

  private static boolean inChapter(Page page, String chapterId) {
    return !page.cover() && chapterId.equals(page.chapterId());
  }

  private static Optional<ResolvedPosition> find(List<Page> pages, Predicate<Page> predicate) {
    for (int i = 0; i < pages.size(); i++) {
      if (predicate.test(pages.get(i))) {
        return Optional.of(at(pages, i));
      }
    }
    return Optional.empty();
  }

  private static ResolvedPosition at(List<Page> pages, int index) {
    Page page = pages.get(index);
    return new ResolvedPosition(index, page.chapterIndex(), page.pageIndex());
  }
}
