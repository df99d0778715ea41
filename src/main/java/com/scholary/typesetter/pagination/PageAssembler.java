package com.scholary.typesetter.pagination;

import com.scholary.typesetter.config.TypesetterProperties.MarginProperties;
import com.scholary.typesetter.content.ContentBlock;
import com.scholary.typesetter.content.HtmlFragments;
import com.scholary.typesetter.content.VideoEmbed;
import com.scholary.typesetter.footnote.Footnote;
import com.scholary.typesetter.footnote.FootnoteRenderer.NumberedContent;
import com.scholary.typesetter.footnote.FootnoteTracker;
import com.scholary.typesetter.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the state of a filled page into a {@link Page} and emits the fixed special pages.
 *
 * <p>Every emitted page takes the chapter's next page index.
 */
public class PageAssembler {

  private static final Logger LOGGER = LoggerFactory.getLogger(PageAssembler.class);

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);
  private final FootnoteTracker footnoteTracker;
  private final MarginProperties margins;
  private final int maxEmptyParagraphRemovals;

  /**
   * @param footnoteTracker numbering and section heights for the run
   * @param margins bottom paddings applied to pages
   * @param screenHeight height of the reading screen, which limits empty paragraph removal
   */
  public PageAssembler(
      FootnoteTracker footnoteTracker, MarginProperties margins, double screenHeight) {
    this.footnoteTracker = footnoteTracker;
    this.margins = margins;
    this.maxEmptyParagraphRemovals = maxEmptyParagraphRemovals(screenHeight);
  }

  /**
   * Emit the page being filled and start a fresh one.
   *
   * @return the emitted page, empty when the page had no content
   */
  public Optional<Page> finalizePage(ChapterPageState state, ContentBlock block) {
    if (state.isEmpty()) {
      return Optional.empty();
    }
    boolean standaloneFirstPage = state.isStandaloneFirstPage();
    List<String> elements =
        standaloneFirstPage
            ? removeEmptyParagraphs(state.elements(), maxEmptyParagraphRemovals)
            : state.elements();

    NumberedContent numbered =
        footnoteTracker.renderer().numberReferences(String.join("", elements));
    List<Footnote> footnotes = numbered.footnotes();
    double padding =
        bottomPadding(footnotes, !state.slices().isEmpty(), standaloneFirstPage);
    String footnotesHtml =
        footnotes.isEmpty() ? "" : footnoteTracker.renderer().renderSection(footnotes);

    ChapterContext context = state.context();
    Page page =
        chapterPage(context, block, state.pageIndex())
            .hasHeading(state.hasHeading())
            .content(PageLayout.wrap(numbered.html(), padding) + footnotesHtml)
            .footnotes(footnotes)
            .backgroundVideo(context.backgroundVideoFor(state.pageIndex()).orElse(null))
            .karaokeSlices(new ArrayList<>(state.slices()))
            .overflowAccepted(state.overflowAccepted())
            .build();
    emit(state, page, elements.size());
    state.startNewPage(false);
    return Optional.of(page);
  }

  public Page emitEpigraphPage(ChapterPageState state, ContentBlock block) {
    Page page =
        chapterPage(state.context(), block, state.pageIndex())
            .epigraphPage(true)
            .epigraph(block.epigraph())
            .build();
    emit(state, page, 0);
    return page;
  }

  public Page emitVideoPage(ChapterPageState state, ContentBlock block, VideoEmbed video) {
    Page page =
        chapterPage(state.context(), block, state.pageIndex())
            .videoPage(true)
            .videoSrc(video.src())
            .build();
    emit(state, page, 0);
    return page;
  }

  /** A field notes page shows a single image over the whole page. */
  public Page emitFieldNotesPage(
      ChapterPageState state, ContentBlock block, String fieldNotesId, String imageUrl) {
    Element content = new Element("div");
    content
        .addClass("field-notes-page")
        .attr("data-field-notes-id", fieldNotesId)
        .attr("data-image-url", imageUrl)
        .attr("style", "background-image: url('" + cssEscape(imageUrl) + "');");
    Page page =
        chapterPage(state.context(), block, state.pageIndex())
            .hasFieldNotes(true)
            .fieldNotesImageUrl(imageUrl)
            .content(HtmlFragments.outerHtml(content))
            .build();
    emit(state, page, 1);
    return page;
  }

  /** Placeholder page for a cover or first page chapter without content. */
  public Page emitEmptyPage(ChapterPageState state) {
    ChapterContext context = state.context();
    Page page =
        Page.builder()
            .chapterIndex(context.chapterIndex())
            .chapterId(context.chapter().id())
            .chapterTitle(context.chapter().title())
            .pageIndex(state.pageIndex())
            .backgroundImageUrl(context.chapter().backgroundImageUrl())
            .firstPage(context.chapter().firstPage())
            .cover(context.chapter().cover())
            .build();
    emit(state, page, 0);
    return page;
  }

  private void emit(ChapterPageState state, Page page, int elements) {
    state.addPage(page);
    structuredLogger.logPageFinalized(
        page.chapterId(),
        page.pageIndex(),
        elements,
        page.footnotes().size(),
        page.overflowAccepted());
  }

  private Page.Builder chapterPage(ChapterContext context, ContentBlock block, int pageIndex) {
    return Page.builder()
        .chapterIndex(context.chapterIndex())
        .chapterId(context.chapter().id())
        .chapterTitle(context.chapter().title())
        .subchapterId(block.subchapterId())
        .subchapterTitle(block.subchapterTitle())
        .pageIndex(pageIndex)
        .backgroundImageUrl(context.chapter().backgroundImageUrl())
        .firstPage(context.chapter().firstPage())
        .cover(context.chapter().cover());
  }

  /**
   * Bottom padding of the page wrapper: the footnote section when there is one, otherwise the
   * karaoke, first page or prose margin.
   */
  double bottomPadding(
      List<Footnote> footnotes, boolean hasKaraoke, boolean standaloneFirstPage) {
    if (!footnotes.isEmpty()) {
      List<Integer> numbers = new ArrayList<>();
      footnotes.forEach(footnote -> numbers.add(footnote.number()));
      return footnoteTracker.measureFootnoteSectionHeight(numbers);
    }
    if (hasKaraoke) {
      return margins.karaokePagePadding();
    }
    return standaloneFirstPage ? margins.firstPageBottomMargin() : margins.prosePagePadding();
  }

  /** Small screens drop more leading blank paragraphs from the first page. */
  static int maxEmptyParagraphRemovals(double screenHeight) {
    if (screenHeight <= 700) {
      return 5;
    }
    if (screenHeight <= 850) {
      return 1;
    }
    return 0;
  }

  /** Drop up to {@code maxRemovals} empty paragraphs from the start of the page. */
  static List<String> removeEmptyParagraphs(List<String> elements, int maxRemovals) {
    int removed = 0;
    while (removed < maxRemovals
        && removed < elements.size()
        && isEmptyParagraph(elements.get(removed))) {
      removed++;
    }
    if (removed > 0) {
      LOGGER.debug("Removed {} leading empty paragraphs from the first page", removed);
    }
    return elements.subList(removed, elements.size());
  }

  private static boolean isEmptyParagraph(String html) {
    if (!html.strip().startsWith("<p")) {
      return false;
    }
    Element paragraph = HtmlFragments.parseElement(html);
    if (!"p".equals(paragraph.normalName()) || !paragraph.text().isBlank()) {
      return false;
    }
    int children = paragraph.childrenSize();
    return children == 0 || (children == 1 && "br".equals(paragraph.child(0).normalName()));
  }

  private static String cssEscape(String url) {
    return url.replace("'", "\\'").replace("\"", "\\\"");
  }
}
