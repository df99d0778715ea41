package com.scholary.typesetter.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.typesetter.pagination.Page;
import java.util.List;
import org.junit.jupiter.api.Test;

class PositionResolverTest {

  private final List<Page> book =
      List.of(
          page("first", -2, 0).firstPage(true).build(),
          page("cover", -1, 0).cover(true).build(),
          page("c1", 1, 0).build(),
          page("c1", 1, 1).build(),
          page("c2", 2, 0).build());

  @Test
  void resolve_exactPage() {
    assertThat(PositionResolver.resolve(book, new ReadingPosition("c1", 1)))
        .isEqualTo(new ResolvedPosition(3, 1, 1));
  }

  @Test
  void resolve_missingPageFallsBackToChapterStart() {
    assertThat(PositionResolver.resolve(book, new ReadingPosition("c1", 9)))
        .isEqualTo(new ResolvedPosition(2, 1, 0));
    assertThat(PositionResolver.resolve(book, new ReadingPosition("c2", null)))
        .isEqualTo(new ResolvedPosition(4, 2, 0));
  }

  @Test
  void resolve_unknownChapterFallsBackToFirstPage() {
    assertThat(PositionResolver.resolve(book, new ReadingPosition("gone", 0)))
        .isEqualTo(new ResolvedPosition(0, -2, 0));
    assertThat(PositionResolver.resolve(book, null)).isEqualTo(new ResolvedPosition(0, -2, 0));
  }

  @Test
  void resolve_coverWhenThereIsNoFirstPage() {
    List<Page> pages = book.subList(1, book.size());

    assertThat(PositionResolver.resolve(pages, new ReadingPosition("gone", 0)))
        .isEqualTo(new ResolvedPosition(0, -1, 0));
  }

  @Test
  void resolve_coverPagesNeverMatchAChapter() {
    assertThat(PositionResolver.resolve(book, new ReadingPosition("cover", 0)))
        .isEqualTo(new ResolvedPosition(0, -2, 0));
  }

  @Test
  void resolve_startOfListWithoutSpecialPages() {
    assertThat(PositionResolver.resolve(book.subList(2, 5), new ReadingPosition("gone", 0)))
        .isEqualTo(new ResolvedPosition(0, 1, 0));
    assertThat(PositionResolver.resolve(List.of(), null)).isEqualTo(ResolvedPosition.START);
  }

  private static Page.Builder page(String chapterId, int chapterIndex, int pageIndex) {
    return Page.builder().chapterId(chapterId).chapterIndex(chapterIndex).pageIndex(pageIndex);
  }
}
