package com.scholary.typesetter.pagination;

import com.scholary.typesetter.content.ContentBlock;
import com.scholary.typesetter.content.ContentElement;
import com.scholary.typesetter.content.ElementKind;
import com.scholary.typesetter.content.HtmlFragments;
import com.scholary.typesetter.footnote.FootnoteTracker;
import com.scholary.typesetter.karaoke.KaraokeCatalog;
import com.scholary.typesetter.karaoke.KaraokeSlice;
import com.scholary.typesetter.karaoke.KaraokeSlicer;
import com.scholary.typesetter.karaoke.KaraokeSource;
import com.scholary.typesetter.karaoke.SliceTarget;
import com.scholary.typesetter.logging.StructuredLogger;
import com.scholary.typesetter.measure.PageMode;
import com.scholary.typesetter.pagination.SplitPolicy.FirstPartVerdict;
import com.scholary.typesetter.pagination.SplitPolicy.FitMeasurement;
import com.scholary.typesetter.split.SplitResult;
import com.scholary.typesetter.split.TextSplitter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Places the elements of a content block onto pages.
 *
 * <p>Elements are taken from a work queue. Atomic elements move whole to the next page when they
 * do not fit. Paragraphs are split at a sentence or word boundary, and the remainder goes back to
 * the front of the queue so it is measured again on the fresh page. Karaoke blocks are handed to
 * the {@link KaraokeSlicer}; field notes blocks get a page of their own.
 *
 * <p>Content is never dropped: an element that cannot fit an empty page is placed anyway and the
 * page is flagged as overflowing.
 */
public class ElementPaginator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ElementPaginator.class);

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);
  private final PageLayout layout;
  private final FootnoteTracker footnoteTracker;
  private final TextSplitter splitter;
  private final SplitPolicy policy;
  private final KaraokeSlicer slicer;
  private final KaraokeCatalog karaokeCatalog;
  private final PageAssembler assembler;

  public ElementPaginator(
      PageLayout layout,
      FootnoteTracker footnoteTracker,
      TextSplitter splitter,
      SplitPolicy policy,
      KaraokeSlicer slicer,
      KaraokeCatalog karaokeCatalog,
      PageAssembler assembler) {
    this.layout = layout;
    this.footnoteTracker = footnoteTracker;
    this.splitter = splitter;
    this.policy = policy;
    this.slicer = slicer;
    this.karaokeCatalog = karaokeCatalog;
    this.assembler = assembler;
  }

  /** Paginate one block and emit its last page. */
  public void paginateBlock(
      ChapterPageState state, ContentBlock block, List<ContentElement> elements) {
    Deque<ContentElement> queue = new ArrayDeque<>(elements);
    while (!queue.isEmpty()) {
      paginateElement(state, block, queue.pollFirst(), queue);
    }
    assembler.finalizePage(state, block);
  }

  private void paginateElement(
      ChapterPageState state,
      ContentBlock block,
      ContentElement element,
      Deque<ContentElement> queue) {
    if (element.isSubchapterTitle() && !state.hasHeading()) {
      state.markHeading();
    }
    if (element.kind() == ElementKind.KARAOKE_BLOCK && placeKaraoke(state, block, element)) {
      return;
    }
    if (element.kind() == ElementKind.FIELD_NOTES && placeFieldNotes(state, block, element)) {
      return;
    }

    Fit fit = measureFit(state, element);
    if (element.kind().isAtomic()) {
      placeAtomic(state, block, element, fit, queue);
    } else if (fit.fits()) {
      placeFitting(state, block, element, fit, queue);
    } else {
      placeOverflowing(state, block, element, fit, queue);
    }
  }

  private Fit measureFit(ChapterPageState state, ContentElement element) {
    SortedSet<Integer> elementFootnotes = footnoteTracker.extractFootnoteRefs(element.html());
    SortedSet<Integer> pageFootnotes = new TreeSet<>(state.footnotes());
    pageFootnotes.addAll(elementFootnotes);

    boolean standaloneFirstPage = state.isStandaloneFirstPage();
    double footnotesHeight = footnoteTracker.measureFootnoteSectionHeight(pageFootnotes);
    double reserve = layout.bottomReserve(footnotesHeight, standaloneFirstPage);
    double available = layout.availableHeight(reserve, state.hasHeading());

    double total = layout.measure(state.elementsWith(element.html()));
    boolean fits =
        standaloneFirstPage || total <= available - policy.safetyMargin(state.hasHeading());
    double current = layout.measure(state.elements());
    double remaining = Math.max(0, available - current);
    return new Fit(
        elementFootnotes, reserve, available, total, remaining, fits, standaloneFirstPage);
  }

  private void placeAtomic(
      ChapterPageState state,
      ContentBlock block,
      ContentElement element,
      Fit fit,
      Deque<ContentElement> queue) {
    if (fit.fits()) {
      state.add(element.html(), fit.elementFootnotes());
      return;
    }
    if (!state.isEmpty()) {
      assembler.finalizePage(state, block);
      state.startNewPage(element.isHeading());
      queue.addFirst(element);
      return;
    }
    state.add(element.html(), fit.elementFootnotes());
    acceptOverflow(state, fit.total() - fit.available(), element.kind() + " taller than page");
  }

  private void placeFitting(
      ChapterPageState state,
      ContentBlock block,
      ContentElement element,
      Fit fit,
      Deque<ContentElement> queue) {
    double finalTotal =
        layout.measureWrapped(state.elementsWith(element.html()), fit.reserve());
    double overflow;
    if (fit.standaloneFirstPage()) {
      overflow = 0;
    } else if (layout.geometry().mode() == PageMode.DOCUMENT) {
      overflow = finalTotal - layout.bodyHeight();
    } else {
      overflow = finalTotal - fit.available();
    }

    FitMeasurement measurement =
        new FitMeasurement(
            element.textLength(),
            fit.remaining(),
            finalTotal,
            fit.available(),
            overflow,
            fit.standaloneFirstPage(),
            queue.isEmpty());
    if (!policy.shouldSplitFittingElement(measurement)) {
      state.add(element.html(), fit.elementFootnotes());
      if (finalTotal > layout.bodyHeight()) {
        acceptOverflow(state, finalTotal - layout.bodyHeight(), "small overflow tolerated");
      }
      return;
    }

    SplitResult split =
        splitter.split(element.html(), fit.remaining(), layout.contentWidth(), layout.style());
    if (!split.hasFirst() || fit.remaining() <= 0) {
      logDecision(state, "defer_no_first_part", fit.remaining(), overflow);
      deferWhole(state, block, element, fit, queue);
      return;
    }

    double firstPartRemaining =
        fit.available() - layout.measureWrapped(state.elementsWith(split.first()), fit.reserve());
    FirstPartVerdict verdict =
        policy.judgeFirstPart(TextSplitter.wordCount(split.first()), firstPartRemaining, overflow);
    logDecision(state, verdict.name().toLowerCase(Locale.ROOT), fit.remaining(), overflow);
    switch (verdict) {
      case KEEP_WHOLE -> {
        state.add(element.html(), fit.elementFootnotes());
        if (finalTotal > layout.bodyHeight()) {
          acceptOverflow(
              state, finalTotal - layout.bodyHeight(), "split would leave the page underfilled");
        }
      }
      case DEFER_WHOLE -> deferWhole(state, block, element, fit, queue);
      case SPLIT -> splitAcrossPages(state, block, element, split, queue);
    }
  }

  private void placeOverflowing(
      ChapterPageState state,
      ContentBlock block,
      ContentElement element,
      Fit fit,
      Deque<ContentElement> queue) {
    if (fit.remaining() <= 0
        || policy.shouldDeferInsteadOfSplitting(fit.remaining(), element.textLength())) {
      logDecision(state, "defer_no_room", fit.remaining(), 0);
      deferWhole(state, block, element, fit, queue);
      return;
    }

    SplitResult split =
        splitter.split(element.html(), fit.remaining(), layout.contentWidth(), layout.style());
    if (split.hasFirst() && policy.isOrphanFirstPart(TextSplitter.wordCount(split.first()))) {
      logDecision(state, "defer_orphan_first_part", fit.remaining(), 0);
      deferWhole(state, block, element, fit, queue);
    } else if (split.hasFirst()
        && layout.measureFragment(split.first()) <= fit.remaining() + policy.fitTolerance()) {
      logDecision(state, "split", fit.remaining(), 0);
      splitAcrossPages(state, block, element, split, queue);
    } else {
      logDecision(state, "defer_first_part_too_tall", fit.remaining(), 0);
      deferWhole(state, block, element, fit, queue);
    }
  }

  private void splitAcrossPages(
      ChapterPageState state,
      ContentBlock block,
      ContentElement element,
      SplitResult split,
      Deque<ContentElement> queue) {
    state.add(split.first(), footnoteTracker.extractFootnoteRefs(split.first()));
    assembler.finalizePage(state, block);
    if (split.hasSecond()) {
      queue.addFirst(remainder(element, split.second()));
    }
  }

  /** Move the element to a fresh page, or place it with overflow when the page is already fresh. */
  private void deferWhole(
      ChapterPageState state,
      ContentBlock block,
      ContentElement element,
      Fit fit,
      Deque<ContentElement> queue) {
    if (!state.isEmpty()) {
      assembler.finalizePage(state, block);
      queue.addFirst(element);
      return;
    }
    state.add(element.html(), fit.elementFootnotes());
    if (fit.total() > fit.available()) {
      acceptOverflow(state, fit.total() - fit.available(), "element cannot be split");
    }
  }

  private boolean placeKaraoke(ChapterPageState state, ContentBlock block, ContentElement element) {
    String blockId = block.subchapterId() != null ? block.subchapterId() : block.chapterId();
    Optional<KaraokeSource> source =
        karaokeCatalog.register(element.html(), state.context().chapterIndex(), blockId);
    if (source.isEmpty()) {
      return false;
    }
    slicer.slice(source.get(), new PageSliceTarget(state, block));
    return true;
  }

  private boolean placeFieldNotes(
      ChapterPageState state, ContentBlock block, ContentElement element) {
    Element root = HtmlFragments.parseElement(element.html());
    Element carrier =
        root.hasAttr("data-field-notes-block")
            ? root
            : root.selectFirst("[data-field-notes-block]");
    if (carrier == null) {
      return false;
    }
    String imageUrl = carrier.attr("data-image-url");
    if (imageUrl.isBlank()) {
      Element image = carrier.selectFirst("img[src]");
      imageUrl = image == null ? "" : image.attr("src");
    }
    if (imageUrl.isBlank()) {
      LOGGER.warn(
          "Field notes block without image, laid out as content: chapter={}",
          state.context().chapter().id());
      return false;
    }

    assembler.finalizePage(state, block);
    state.startNewPage(false);
    String id = carrier.attr("data-field-notes-id");
    if (id.isBlank()) {
      id = "field-notes-" + state.context().chapter().id() + "-" + state.pageIndex();
    }
    assembler.emitFieldNotesPage(state, block, id, imageUrl);
    return true;
  }

  private void acceptOverflow(ChapterPageState state, double overflow, String reason) {
    state.flagOverflow();
    structuredLogger.logOverflowAccepted(
        state.context().chapter().id(), state.pageIndex(), overflow, reason);
  }

  private void logDecision(
      ChapterPageState state, String decision, double remaining, double overflow) {
    structuredLogger.logSplitDecision(
        state.context().chapter().id(), state.pageIndex(), decision, remaining, overflow);
  }

  private static ContentElement remainder(ContentElement element, String html) {
    int textLength = HtmlFragments.rawText(HtmlFragments.parseBody(html)).length();
    return new ContentElement(element.kind(), html, element.tagName(), textLength);
  }

  /**
   * Measurements of an element against the page being filled.
   *
   * @param elementFootnotes footnotes referenced by the element
   * @param reserve bottom reserve with the element's footnotes
   * @param available content height of the page
   * @param total height of the page content with the element
   * @param remaining content height left before the element
   * @param fits whether the element fits with the safety margin
   * @param standaloneFirstPage whether the page is the first page chapter's first page
   */
  private record Fit(
      SortedSet<Integer> elementFootnotes,
      double reserve,
      double available,
      double total,
      double remaining,
      boolean fits,
      boolean standaloneFirstPage) {}

  /** Slices karaoke text into the chapter's page flow. */
  private final class PageSliceTarget implements SliceTarget {

    private final ChapterPageState state;
    private final ContentBlock block;

    PageSliceTarget(ChapterPageState state, ContentBlock block) {
      this.state = state;
      this.block = block;
    }

    @Override
    public boolean isEmpty() {
      return state.isEmpty();
    }

    @Override
    public double remainingHeight() {
      double footnotesHeight = footnoteTracker.measureFootnoteSectionHeight(state.footnotes());
      double available =
          layout.availableHeight(layout.karaokeReserve(footnotesHeight), state.hasHeading());
      return Math.max(0, available - layout.measure(state.elements()));
    }

    @Override
    public void place(KaraokeSlice slice, String html) {
      state.addSlice(slice, html, footnoteTracker.extractFootnoteRefs(html));
      karaokeCatalog.recordSlice(slice);
    }

    @Override
    public void breakPage() {
      assembler.finalizePage(state, block);
    }
  }
}
