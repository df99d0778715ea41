package com.scholary.typesetter.karaoke;

import com.scholary.typesetter.content.HtmlFragments;
import com.scholary.typesetter.logging.StructuredLogger;
import com.scholary.typesetter.measure.StyleContext;
import com.scholary.typesetter.split.SplitResult;
import com.scholary.typesetter.split.TextSplitter;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cuts the text of a karaoke source into consecutive slices, one per page.
 *
 * <p>A cursor walks the source text. Each step fits as many whole words as the page has room for;
 * when not even one word fits, a non-empty page is emitted first and an empty page takes a forced
 * chunk. The slices of a source are contiguous and cover its whole text.
 */
public class KaraokeSlicer {

  private static final Logger LOGGER = LoggerFactory.getLogger(KaraokeSlicer.class);

  public static final String BLOCK_CLASS = "karaoke-block";
  public static final String SLICE_CLASS = "karaoke-slice";

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);
  private final TextSplitter splitter;
  private final double widthPx;
  private final StyleContext style;
  private final int minForcedChunk;

  public KaraokeSlicer(
      TextSplitter splitter, double widthPx, StyleContext style, int minForcedChunk) {
    this.splitter = splitter;
    this.widthPx = widthPx;
    this.style = style;
    this.minForcedChunk = minForcedChunk;
  }

  /** Slice the whole source into the target. The last slice stays on the open page. */
  public void slice(KaraokeSource source, SliceTarget target) {
    String text = source.text();
    int cursor = 0;
    while (cursor < text.length()) {
      double remaining = target.remainingHeight();
      int chars = 0;
      if (remaining > 0) {
        SplitResult split =
            splitter.splitAtWordBoundary(
                measureMarkup(text.substring(cursor)), remaining, widthPx, style);
        chars = split.firstCharCount();
      }

      boolean forced = false;
      if (chars == 0) {
        if (!target.isEmpty()) {
          target.breakPage();
          continue;
        }
        chars = Math.min(text.length() - cursor, minForcedChunk);
        forced = true;
      }

      KaraokeSlice slice = new KaraokeSlice(source.id(), cursor, cursor + chars);
      target.place(slice, render(source, slice));
      structuredLogger.logKaraokeSlice(source.id(), slice.startChar(), slice.endChar(), forced);
      cursor = slice.endChar();

      if (cursor < text.length()) {
        target.breakPage();
      }
    }
  }

  /** Page markup of a slice: newlines become line breaks, text is escaped. */
  public static String render(KaraokeSource source, KaraokeSlice slice) {
    Element span =
        new Element("span")
            .addClass(SLICE_CLASS)
            .attr(KaraokeSourceFactory.ID_ATTRIBUTE, slice.karaokeId())
            .attr("data-karaoke-start", String.valueOf(slice.startChar()))
            .attr("data-karaoke-end", String.valueOf(slice.endChar()));
    String[] lines = source.text().substring(slice.startChar(), slice.endChar()).split("\n", -1);
    for (int i = 0; i < lines.length; i++) {
      if (i > 0) {
        span.appendElement("br");
      }
      if (!lines[i].isEmpty()) {
        span.appendChild(new TextNode(lines[i]));
      }
    }
    Element block = new Element("div").addClass(BLOCK_CLASS);
    block.appendChild(span);
    return HtmlFragments.outerHtml(block);
  }

  /** Measurement markup keeps the raw text, so split offsets are text offsets. */
  static String measureMarkup(String text) {
    return "<div class=\"" + BLOCK_CLASS + "\">" + HtmlFragments.escapeText(text) + "</div>";
  }
}
