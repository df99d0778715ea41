package com.scholary.typesetter.pagination;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.scholary.typesetter.LayoutFixtures;
import com.scholary.typesetter.config.TypesetterProperties.MarginProperties;
import com.scholary.typesetter.content.BlockKind;
import com.scholary.typesetter.content.ChapterRecord;
import com.scholary.typesetter.content.ContentBlock;
import com.scholary.typesetter.content.Epigraph;
import com.scholary.typesetter.content.VideoEmbed;
import com.scholary.typesetter.footnote.Footnote;
import com.scholary.typesetter.footnote.FootnoteRegistry;
import com.scholary.typesetter.footnote.FootnoteTracker;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PageAssemblerTest {

  private FootnoteTracker tracker;
  private PageAssembler assembler;

  @BeforeEach
  void setUp() {
    tracker =
        new FootnoteTracker(
            FootnoteRegistry.fromHtml(List.of("<p>a^[Only note]</p>")),
            LayoutFixtures.oracle(),
            LayoutFixtures.style(),
            140,
            16);
    assembler =
        new PageAssembler(tracker, MarginProperties.defaults(), LayoutFixtures.PAGE_HEIGHT);
  }

  @Test
  void finalizePage_emptyStateEmitsNothing() {
    ChapterPageState state = state(LayoutFixtures.chapter("c1", 1, "<p>x</p>"));

    assertThat(assembler.finalizePage(state, block("c1"))).isEmpty();
    assertThat(state.pages()).isEmpty();
  }

  @Test
  void finalizePage_emitsPageAndAdvancesIndex() {
    ChapterPageState state =
        new ChapterPageState(
            new ChapterContext(
                LayoutFixtures.chapter("c1", 1, "<p>x</p>"), 1, Map.of(1, "bg.mp4")));
    state.add("<p>x</p>", Set.of());
    state.markHeading();

    Page page = assembler.finalizePage(state, block("c1")).orElseThrow();

    assertThat(page.pageIndex()).isZero();
    assertThat(page.chapterIndex()).isEqualTo(1);
    assertThat(page.hasHeading()).isTrue();
    assertThat(page.backgroundVideo()).isEqualTo("bg.mp4");
    assertThat(state.pageIndex()).isEqualTo(1);
    assertThat(state.isEmpty()).isTrue();
    assertThat(state.hasHeading()).isFalse();
  }

  @Test
  void finalizePage_appendsFootnoteSection() {
    ChapterPageState state = state(LayoutFixtures.chapter("c1", 1, "<p>a^[Only note]</p>"));
    state.add("<p>a^[Only note]</p>", Set.of(1));

    Page page = assembler.finalizePage(state, block("c1")).orElseThrow();

    assertThat(page.footnotes()).containsExactly(new Footnote(1, "Only note"));
    assertThat(page.content())
        .contains("data-footnote-number=\"1\">1</sup>")
        .endsWith("</div>")
        .contains("<div class=\"footnotes-section\">");
  }

  @Test
  void finalizePage_standaloneFirstPageDropsLeadingEmptyParagraphs() {
    ChapterPageState state = state(LayoutFixtures.firstPage("f", "<p>x</p>"));
    state.add("<p></p>", Set.of());
    state.add("<p><br></p>", Set.of());
    state.add("<p>x</p>", Set.of());

    Page page = assembler.finalizePage(state, block("f")).orElseThrow();

    assertThat(page.content())
        .isEqualTo(
            "<div class=\"page-content-main\" style=\"padding-bottom: 20px;\"><p>x</p></div>");
    assertThat(page.firstPage()).isTrue();
  }

  @Test
  void bottomPadding_dependsOnPageKind() {
    assertThat(assembler.bottomPadding(List.of(), false, false)).isEqualTo(48);
    assertThat(assembler.bottomPadding(List.of(), true, false)).isEqualTo(32);
    assertThat(assembler.bottomPadding(List.of(), false, true)).isEqualTo(20);
  }

  @Test
  void bottomPadding_usesFootnoteSectionHeight() {
    FootnoteTracker footnotes = mock(FootnoteTracker.class);
    when(footnotes.measureFootnoteSectionHeight(List.of(1))).thenReturn(77.0);
    PageAssembler withFootnotes = new PageAssembler(footnotes, MarginProperties.defaults(), 300);

    assertThat(withFootnotes.bottomPadding(List.of(new Footnote(1, "n")), true, false))
        .isEqualTo(77);
  }

  @Test
  void maxEmptyParagraphRemovals_shrinksOnTallerScreens() {
    assertThat(PageAssembler.maxEmptyParagraphRemovals(650)).isEqualTo(5);
    assertThat(PageAssembler.maxEmptyParagraphRemovals(800)).isEqualTo(1);
    assertThat(PageAssembler.maxEmptyParagraphRemovals(1000)).isZero();
  }

  @Test
  void removeEmptyParagraphs_stopsAtContentAndLimit() {
    List<String> elements = List.of("<p></p>", "<p><br></p>", "<p>x</p>", "<p></p>");

    assertThat(PageAssembler.removeEmptyParagraphs(elements, 5))
        .containsExactly("<p>x</p>", "<p></p>");
    assertThat(PageAssembler.removeEmptyParagraphs(elements, 1))
        .containsExactly("<p><br></p>", "<p>x</p>", "<p></p>");
    assertThat(PageAssembler.removeEmptyParagraphs(List.of("<h2></h2>"), 5))
        .containsExactly("<h2></h2>");
  }

  @Test
  void emitEmptyPage_forCoverWithoutContent() {
    ChapterPageState state =
        new ChapterPageState(new ChapterContext(LayoutFixtures.cover("cv", ""), -1, Map.of()));

    Page page = assembler.emitEmptyPage(state);

    assertThat(page.cover()).isTrue();
    assertThat(page.chapterIndex()).isEqualTo(-1);
    assertThat(page.content()).isEmpty();
    assertThat(state.pages()).containsExactly(page);
  }

  @Test
  void emitEpigraphAndVideoPages_takeConsecutiveIndexes() {
    ChapterPageState state = state(LayoutFixtures.chapter("c1", 1, "<p>x</p>"));
    Epigraph epigraph = new Epigraph("Words", "Someone", "center");
    ContentBlock block =
        new ContentBlock(BlockKind.CHAPTER, "Chapter c1", "<p>x</p>", epigraph, "c1", null, false);

    Page epigraphPage = assembler.emitEpigraphPage(state, block);
    Page videoPage = assembler.emitVideoPage(state, block, new VideoEmbed("v.mp4", "<video>"));

    assertThat(epigraphPage.epigraphPage()).isTrue();
    assertThat(epigraphPage.epigraph()).isEqualTo(epigraph);
    assertThat(videoPage.videoPage()).isTrue();
    assertThat(videoPage.videoSrc()).isEqualTo("v.mp4");
    assertThat(state.pages()).extracting(Page::pageIndex).containsExactly(0, 1);
  }

  private static ChapterPageState state(ChapterRecord chapter) {
    int chapterIndex = ChapterContext.chapterIndexOf(chapter, 0);
    return new ChapterPageState(new ChapterContext(chapter, chapterIndex, Map.of()));
  }

  private static ContentBlock block(String chapterId) {
    return new ContentBlock(
        BlockKind.CHAPTER, "Chapter " + chapterId, "<p>x</p>", null, chapterId, null, false);
  }
}
