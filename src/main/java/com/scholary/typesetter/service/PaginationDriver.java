package com.scholary.typesetter.service;

import com.scholary.typesetter.config.TypesetterProperties;
import com.scholary.typesetter.content.ChapterRecord;
import com.scholary.typesetter.content.ContentBlock;
import com.scholary.typesetter.content.ContentBlockBuilder;
import com.scholary.typesetter.content.ContentPreprocessor;
import com.scholary.typesetter.content.ElementParser;
import com.scholary.typesetter.content.ImageLoadWaiter;
import com.scholary.typesetter.content.PreparedBlock;
import com.scholary.typesetter.footnote.FootnoteRegistry;
import com.scholary.typesetter.footnote.FootnoteTracker;
import com.scholary.typesetter.karaoke.KaraokeCatalog;
import com.scholary.typesetter.karaoke.KaraokeSlicer;
import com.scholary.typesetter.karaoke.KaraokeSourceFactory;
import com.scholary.typesetter.measure.ImageDimensions;
import com.scholary.typesetter.measure.MeasurementOracle;
import com.scholary.typesetter.measure.PageGeometry;
import com.scholary.typesetter.measure.StyleContext;
import com.scholary.typesetter.pagination.ChapterContext;
import com.scholary.typesetter.pagination.ChapterPageState;
import com.scholary.typesetter.pagination.ElementPaginator;
import com.scholary.typesetter.pagination.Page;
import com.scholary.typesetter.pagination.PageAssembler;
import com.scholary.typesetter.pagination.PageLayout;
import com.scholary.typesetter.pagination.SplitPolicy;
import com.scholary.typesetter.split.TextSplitter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Paginates a whole book.
 *
 * <p>Chapters are sorted so the standalone first page and the cover come first. Footnotes are
 * numbered across the sorted book before any page is laid out. Each chapter is then paginated
 * block by block: the epigraph page, the block's blank-page videos, then its flowed content.
 */
@Component
public class PaginationDriver {

  private static final Logger LOGGER = LoggerFactory.getLogger(PaginationDriver.class);

  static final Comparator<ChapterRecord> READING_ORDER =
      Comparator.comparing((ChapterRecord chapter) -> !chapter.firstPage())
          .thenComparing(chapter -> !chapter.cover())
          .thenComparingInt(chapter -> chapter.order() == null ? 0 : chapter.order());

  private final TypesetterProperties properties;
  private final MeasurementOracle oracle;
  private final ContentBlockBuilder blockBuilder;
  private final ContentPreprocessor preprocessor;
  private final ElementParser elementParser;
  private final ImageLoadWaiter imageLoadWaiter;
  private final KaraokeSourceFactory karaokeSourceFactory;

  public PaginationDriver(
      TypesetterProperties properties,
      MeasurementOracle oracle,
      ContentBlockBuilder blockBuilder,
      ContentPreprocessor preprocessor,
      ElementParser elementParser,
      ImageLoadWaiter imageLoadWaiter,
      KaraokeSourceFactory karaokeSourceFactory) {
    this.properties = properties;
    this.oracle = oracle;
    this.blockBuilder = blockBuilder;
    this.preprocessor = preprocessor;
    this.elementParser = elementParser;
    this.imageLoadWaiter = imageLoadWaiter;
    this.karaokeSourceFactory = karaokeSourceFactory;
  }

  /**
   * Paginate the chapters onto pages of the given geometry.
   *
   * @param superseded checked between chapters and blocks; once true the run is abandoned
   * @throws PaginationSupersededException when {@code superseded} turns true
   */
  public PaginationResult paginate(
      List<ChapterRecord> chapters, PageGeometry geometry, BooleanSupplier superseded) {
    if (chapters == null || chapters.isEmpty()) {
      LOGGER.warn("No chapters to paginate");
      return PaginationResult.empty();
    }
    List<ChapterRecord> sorted = new ArrayList<>(chapters);
    sorted.sort(READING_ORDER);

    List<List<ContentBlock>> blocksByChapter = new ArrayList<>();
    List<String> allHtml = new ArrayList<>();
    for (ChapterRecord chapter : sorted) {
      List<ContentBlock> blocks = blockBuilder.build(chapter);
      blocksByChapter.add(blocks);
      blocks.forEach(block -> allHtml.add(block.html()));
    }
    Map<String, ImageDimensions> images = imageLoadWaiter.awaitImages(allHtml);
    checkCurrent(superseded);

    Run run = newRun(sorted, geometry, images);
    List<Page> pages = new ArrayList<>();
    for (int position = 0; position < sorted.size(); position++) {
      ChapterRecord chapter = sorted.get(position);
      List<ContentBlock> blocks = blocksByChapter.get(position);
      int chapterIndex = ChapterContext.chapterIndexOf(chapter, position);

      if (blocks.isEmpty()) {
        if (chapter.isSpecial()) {
          ChapterPageState state =
              new ChapterPageState(new ChapterContext(chapter, chapterIndex, Map.of()));
          run.assembler().emitEmptyPage(state);
          pages.addAll(state.pages());
        } else {
          LOGGER.debug("Skipping chapter without content: id={}", chapter.id());
        }
        continue;
      }

      ChapterPageState state =
          new ChapterPageState(
              new ChapterContext(
                  chapter, chapterIndex, preprocessor.extractBackgroundVideos(blocks)));
      for (ContentBlock block : blocks) {
        checkCurrent(superseded);
        paginateBlock(run, state, block);
      }
      pages.addAll(state.pages());
      LOGGER.debug(
          "Chapter paginated: id={}, index={}, pages={}",
          chapter.id(),
          chapterIndex,
          state.pages().size());
    }

    return new PaginationResult(
        PageFinalizer.finalizePages(pages), run.catalog().sources(), run.catalog().slices());
  }

  private void paginateBlock(Run run, ChapterPageState state, ContentBlock block) {
    if (block.epigraph() != null && !block.epigraph().isEmpty()) {
      run.assembler().emitEpigraphPage(state, block);
    }
    PreparedBlock prepared = preprocessor.prepare(block);
    prepared.blankPageVideos().forEach(video -> run.assembler().emitVideoPage(state, block, video));
    run.paginator().paginateBlock(state, block, elementParser.parse(prepared.html()));
  }

  /** Per-run collaborators. Footnote numbering and karaoke sources are scoped to one run. */
  private Run newRun(
      List<ChapterRecord> sorted, PageGeometry geometry, Map<String, ImageDimensions> images) {
    StyleContext style =
        StyleContext.of(properties.typography(), properties.images()).withImageDimensions(images);
    PageLayout layout = new PageLayout(oracle, geometry, style, properties.margins());
    FootnoteTracker footnotes =
        new FootnoteTracker(
            FootnoteRegistry.fromChapters(sorted),
            oracle,
            style,
            layout.footnoteSectionWidth(),
            properties.margins().footnoteExtraPadding());
    TextSplitter splitter = new TextSplitter(oracle, properties.thresholds().fitTolerance());
    KaraokeSlicer slicer =
        new KaraokeSlicer(
            splitter, layout.contentWidth(), style, properties.karaoke().minForcedChunkChars());
    KaraokeCatalog catalog = new KaraokeCatalog(karaokeSourceFactory);
    PageAssembler assembler =
        new PageAssembler(footnotes, properties.margins(), geometry.pageHeight());
    ElementPaginator paginator =
        new ElementPaginator(
            layout,
            footnotes,
            splitter,
            new SplitPolicy(properties.thresholds()),
            slicer,
            catalog,
            assembler);
    return new Run(paginator, assembler, catalog);
  }

  private static void checkCurrent(BooleanSupplier superseded) {
    if (superseded.getAsBoolean()) {
      throw new PaginationSupersededException("Pagination superseded by a newer run");
    }
  }

  private record Run(ElementPaginator paginator, PageAssembler assembler, KaraokeCatalog catalog) {}
}
