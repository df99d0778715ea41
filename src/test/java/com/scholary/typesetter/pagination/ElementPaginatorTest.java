package com.scholary.typesetter.pagination;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.typesetter.LayoutFixtures;
import com.scholary.typesetter.config.TypesetterProperties;
import com.scholary.typesetter.content.ChapterRecord;
import com.scholary.typesetter.content.ContentBlock;
import com.scholary.typesetter.content.ContentBlockBuilder;
import com.scholary.typesetter.content.ElementParser;
import com.scholary.typesetter.content.HtmlFragments;
import com.scholary.typesetter.footnote.Footnote;
import com.scholary.typesetter.footnote.FootnoteRegistry;
import com.scholary.typesetter.footnote.FootnoteTracker;
import com.scholary.typesetter.karaoke.KaraokeCatalog;
import com.scholary.typesetter.karaoke.KaraokeSlice;
import com.scholary.typesetter.karaoke.KaraokeSlicer;
import com.scholary.typesetter.karaoke.KaraokeSourceFactory;
import com.scholary.typesetter.measure.FixedAdvanceTextWidthMeter;
import com.scholary.typesetter.measure.LayoutMeasurementOracle;
import com.scholary.typesetter.measure.MeasurementOracle;
import com.scholary.typesetter.split.TextSplitter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ElementPaginatorTest {

  private TypesetterProperties properties;
  private KaraokeCatalog catalog;

  @BeforeEach
  void setUp() {
    properties = LayoutFixtures.properties();
    catalog = new KaraokeCatalog(new KaraokeSourceFactory(new ObjectMapper()));
  }

  @Test
  void paginateBlock_splitsLongParagraphAcrossPages() {
    List<Page> pages = paginate("<p>" + LayoutFixtures.words(144, "abcd") + "</p>");

    assertThat(pages).extracting(Page::pageIndex).containsExactly(0, 1, 2);
    assertThat(pages)
        .extracting(page -> occurrences(page.content(), "abcd"))
        .containsExactly(52, 52, 40);
    assertThat(pages).noneMatch(Page::overflowAccepted);
  }

  @Test
  void paginateBlock_wrapsPageWithProsePadding() {
    List<Page> pages = paginate("<p>short</p>");

    assertThat(pages).hasSize(1);
    assertThat(pages.get(0).content())
        .isEqualTo(
            "<div class=\"page-content-main\" style=\"padding-bottom: 48px;\"><p>short</p></div>");
    assertThat(pages.get(0).hasHeading()).isFalse();
    assertThat(pages.get(0).chapterId()).isEqualTo("c1");
  }

  @Test
  void paginateBlock_marksPageWithSubchapterTitle() {
    List<Page> pages = paginate("<h4>Title</h4><p>short</p>");

    assertThat(pages).hasSize(1);
    assertThat(pages.get(0).hasHeading()).isTrue();
  }

  @Test
  void paginateBlock_movesImageThatDoesNotFitToNextPage() {
    String html =
        "<p>" + LayoutFixtures.words(40, "abcd") + "</p>"
            + "<img src=\"a.png\" width=\"200\" height=\"100\">";

    List<Page> pages = paginate(html);

    assertThat(pages).hasSize(2);
    assertThat(pages.get(0).content()).doesNotContain("<img");
    assertThat(pages.get(1).content()).contains("<img");
    assertThat(pages).noneMatch(Page::overflowAccepted);
  }

  @Test
  void paginateBlock_acceptsOverflowForImageTallerThanPage() {
    List<Page> pages = paginate("<img src=\"tall.png\" width=\"200\" height=\"400\">");

    assertThat(pages).hasSize(1);
    assertThat(pages.get(0).overflowAccepted()).isTrue();
    assertThat(pages.get(0).content()).contains("tall.png");
  }

  @Test
  void paginateBlock_slicesKaraokeAcrossPages() {
    String html = LayoutFixtures.karaokeBlock("song", LayoutFixtures.words(90, "abcd"), 0.5);

    List<Page> pages = paginate(html);

    assertThat(pages).hasSize(2);
    assertThat(pages.get(0).karaokeSlices())
        .extracting(KaraokeSlice::startChar, KaraokeSlice::endChar)
        .containsExactly(tuple(0, 259));
    assertThat(pages.get(1).karaokeSlices())
        .extracting(KaraokeSlice::startChar, KaraokeSlice::endChar)
        .containsExactly(tuple(259, 449));
    assertThat(pages.get(0).content())
        .startsWith("<div class=\"page-content-main\" style=\"padding-bottom: 32px;\">")
        .contains(KaraokeSlicer.BLOCK_CLASS);
    assertThat(catalog.isFullyCovered("song")).isTrue();
  }

  @Test
  void paginateBlock_numbersFootnotesOnThePage() {
    List<Page> pages = paginate("<p>First^[Note one] and second^[Note two]</p>");

    assertThat(pages).hasSize(1);
    Page page = pages.get(0);
    assertThat(page.footnotes())
        .containsExactly(new Footnote(1, "Note one"), new Footnote(2, "Note two"));
    assertThat(page.content())
        .contains("data-footnote-number=\"1\">1</sup>")
        .contains("data-footnote-number=\"2\">2</sup>")
        .contains("footnotes-section")
        .doesNotContain("^[");
  }

  @Test
  void paginateBlock_givesFieldNotesTheirOwnPage() {
    String html =
        "<p>intro</p>"
            + "<div data-field-notes-block data-image-url=\"notes.jpg\""
            + " data-field-notes-id=\"fn1\"></div>"
            + "<p>after</p>";

    List<Page> pages = paginate(html);

    assertThat(pages).hasSize(3);
    assertThat(pages.get(0).content()).contains("intro");
    assertThat(pages.get(1).hasFieldNotes()).isTrue();
    assertThat(pages.get(1).fieldNotesImageUrl()).isEqualTo("notes.jpg");
    assertThat(pages.get(1).content()).contains("data-field-notes-id=\"fn1\"");
    assertThat(pages.get(2).content()).contains("after");
  }

  @Test
  void paginateBlock_keepsEveryWord() {
    List<Page> pages =
        paginate(
            "<p>" + LayoutFixtures.words(30, "abcd") + "</p>"
                + "<p>" + LayoutFixtures.words(70, "wxyz") + "</p>");

    assertThat(pages.stream().mapToInt(page -> occurrences(page.content(), "abcd")).sum())
        .isEqualTo(30);
    assertThat(pages.stream().mapToInt(page -> occurrences(page.content(), "wxyz")).sum())
        .isEqualTo(70);
  }

  @Test
  void paginateBlock_movesParagraphWhoseFirstPartWouldBeOneWord() {
    String longWord = "qrstuvwxyzqrstuvwx";
    String html =
        "<p>" + LayoutFixtures.words(48, "abcd") + "</p>"
            + "<p>ab " + LayoutFixtures.words(30, longWord) + "</p>";

    List<Page> pages = paginate(html);

    assertThat(occurrences(pages.get(0).content(), "abcd")).isEqualTo(48);
    assertThat(pages.get(0).content()).doesNotContain("<p>ab");
    assertThat(pages.get(1).content()).contains("<p>ab " + longWord);
    assertThat(pages.stream().mapToInt(page -> occurrences(page.content(), longWord)).sum())
        .isEqualTo(30);
    assertThat(pages).noneMatch(Page::overflowAccepted);
  }

  @Test
  void paginateBlock_defersFittingParagraphThatWouldCrowdThePageBottom() {
    // 5px characters: 40 per line, so a two-line paragraph carries more than 50 characters
    MeasurementOracle narrow = new LayoutMeasurementOracle(new FixedAdvanceTextWidthMeter(0.25));
    String html =
        "<p>" + LayoutFixtures.words(88, "abcd") + "</p>"
            + "<p>" + LayoutFixtures.words(16, "wxyz") + "</p>";

    List<Page> pages = paginate(html, narrow);

    assertThat(pages).hasSize(2);
    assertThat(occurrences(pages.get(0).content(), "abcd")).isEqualTo(88);
    assertThat(pages.get(0).content()).doesNotContain("wxyz");
    assertThat(occurrences(pages.get(1).content(), "wxyz")).isEqualTo(16);
    assertThat(pages).noneMatch(Page::overflowAccepted);
  }

  @Test
  void paginateBlock_keepsEveryPageWithinTheBodyHeight() {
    String html =
        "<h4>Opening</h4>"
            + "<p>" + LayoutFixtures.words(30, "abcd") + "</p>"
            + "<p>Short one.</p>"
            + "<img src=\"a.png\" width=\"200\" height=\"60\">"
            + "<p>" + "First sentence here. Second one follows. ".repeat(10).trim() + "</p>"
            + "<p>" + LayoutFixtures.words(70, "wxyz") + "</p>"
            + "<img src=\"b.png\" width=\"200\" height=\"120\">"
            + "<p>" + LayoutFixtures.words(25, "abcd") + "</p>";
    PageLayout layout = layout(LayoutFixtures.oracle());
    double reserve = properties.margins().calculationBottomMargin();

    List<Page> pages = paginate(html);

    assertThat(pages).hasSizeGreaterThan(3);
    List<Page> bounded =
        pages.stream().filter(page -> !page.overflowAccepted()).collect(Collectors.toList());
    assertThat(bounded).isNotEmpty();
    assertThat(bounded)
        .allSatisfy(
            page ->
                assertThat(layout.measureWrapped(contentElements(page), reserve))
                    .isLessThanOrEqualTo(layout.bodyHeight() + 2));
  }

  private List<Page> paginate(String html) {
    return paginate(html, LayoutFixtures.oracle());
  }

  private List<Page> paginate(String html, MeasurementOracle oracle) {
    PageLayout layout = layout(oracle);
    ChapterRecord chapter = LayoutFixtures.chapter("c1", 1, html);
    FootnoteTracker tracker =
        new FootnoteTracker(
            FootnoteRegistry.fromChapters(List.of(chapter)),
            oracle,
            LayoutFixtures.style(),
            layout.footnoteSectionWidth(),
            properties.margins().footnoteExtraPadding());
    TextSplitter splitter = new TextSplitter(oracle, 2);
    ElementPaginator paginator =
        new ElementPaginator(
            layout,
            tracker,
            splitter,
            new SplitPolicy(properties.thresholds()),
            new KaraokeSlicer(splitter, layout.contentWidth(), LayoutFixtures.style(), 80),
            catalog,
            new PageAssembler(tracker, properties.margins(), LayoutFixtures.PAGE_HEIGHT));

    ChapterPageState state = new ChapterPageState(new ChapterContext(chapter, 1, Map.of()));
    ContentBlock block = new ContentBlockBuilder().build(chapter).get(0);
    paginator.paginateBlock(state, block, new ElementParser().parse(html));
    return state.pages();
  }

  private PageLayout layout(MeasurementOracle oracle) {
    return new PageLayout(
        oracle, LayoutFixtures.geometry(), LayoutFixtures.style(), properties.margins());
  }

  /** Elements inside the page wrapper, without the padding it was emitted with. */
  private static List<String> contentElements(Page page) {
    Element wrapper =
        HtmlFragments.parseBody(page.content()).selectFirst("." + PageLayout.CONTENT_WRAPPER_CLASS);
    return wrapper.children().stream().map(HtmlFragments::outerHtml).collect(Collectors.toList());
  }

  private static int occurrences(String text, String word) {
    return text.split(word, -1).length - 1;
  }
}
