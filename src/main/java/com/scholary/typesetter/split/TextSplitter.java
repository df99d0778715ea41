package com.scholary.typesetter.split;

import com.scholary.typesetter.content.HtmlFragments;
import com.scholary.typesetter.footnote.FootnoteMarkers;
import com.scholary.typesetter.measure.MeasurementOracle;
import com.scholary.typesetter.measure.StyleContext;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.nodes.Element;

/**
 * Splits a splittable element so that its first part fits a height budget.
 *
 * <p>Two boundary kinds are tried in order:
 *
 * <ol>
 *   <li>Sentence: after {@code .}, {@code !} or {@code ?} followed by whitespace and a capital
 *       letter
 *   <li>Word: after the last whole word that fits, preferring a word that does not end in
 *       punctuation
 * </ol>
 *
 * <p>A split never lands inside a word or inside an inline {@code ^[...]} footnote marker. Heights
 * are measured on the element alone; a part fits when its height is within the budget plus the fit
 * tolerance. Candidate boundaries are searched with a binary search, relying on height growing
 * with text length.
 */
public class TextSplitter {

  private static final Pattern SENTENCE_END = Pattern.compile("[.!?]\\s+(?=[A-Z])");
  private static final String AVOID_BREAK_AFTER = ",.;:!?";

  private final MeasurementOracle oracle;
  private final double fitTolerance;

  public TextSplitter(MeasurementOracle oracle, double fitTolerance) {
    this.oracle = oracle;
    this.fitTolerance = fitTolerance;
  }

  /** Sentence split with word split as the fallback. */
  public SplitResult split(String html, double maxHeight, double widthPx, StyleContext style) {
    return splitAtSentenceBoundary(html, maxHeight, widthPx, style);
  }

  public SplitResult splitAtSentenceBoundary(
      String html, double maxHeight, double widthPx, StyleContext style) {
    Element element = HtmlFragments.parseElement(html);
    String text = HtmlFragments.rawText(element);
    if (text.isBlank() || fits(HtmlFragments.outerHtml(element), maxHeight, widthPx, style)) {
      return SplitResult.whole(HtmlFragments.outerHtml(element), text.length());
    }

    List<int[]> protectedRanges = footnoteMarkerRanges(text);
    List<Integer> boundaries = new ArrayList<>();
    Matcher matcher = SENTENCE_END.matcher(text);
    while (matcher.find()) {
      int boundary = matcher.start() + 1;
      if (!isProtected(boundary, protectedRanges)) {
        boundaries.add(boundary);
      }
    }
    if (boundaries.isEmpty()) {
      return splitAtWordBoundary(element, text, maxHeight, widthPx, style, protectedRanges);
    }

    int best = largestFitting(element, boundaries, maxHeight, widthPx, style);
    if (best < 0) {
      return splitAtWordBoundary(element, text, maxHeight, widthPx, style, protectedRanges);
    }
    int boundary = boundaries.get(best);
    return new SplitResult(
        HtmlTextCutter.prefix(element, boundary),
        HtmlTextCutter.suffix(element, boundary),
        boundary,
        SplitBoundary.SENTENCE);
  }

  public SplitResult splitAtWordBoundary(
      String html, double maxHeight, double widthPx, StyleContext style) {
    Element element = HtmlFragments.parseElement(html);
    String text = HtmlFragments.rawText(element);
    if (text.isBlank() || fits(HtmlFragments.outerHtml(element), maxHeight, widthPx, style)) {
      return SplitResult.whole(HtmlFragments.outerHtml(element), text.length());
    }
    return splitAtWordBoundary(
        element, text, maxHeight, widthPx, style, footnoteMarkerRanges(text));
  }

  private SplitResult splitAtWordBoundary(
      Element element,
      String text,
      double maxHeight,
      double widthPx,
      StyleContext style,
      List<int[]> protectedRanges) {
    List<Integer> candidates = new ArrayList<>();
    for (int i = 1; i < text.length(); i++) {
      if (Character.isWhitespace(text.charAt(i))
          && !Character.isWhitespace(text.charAt(i - 1))
          && !isProtected(i, protectedRanges)) {
        candidates.add(i);
      }
    }
    if (candidates.isEmpty()) {
      return SplitResult.nothingFits(HtmlFragments.outerHtml(element));
    }

    int best = largestFitting(element, candidates, maxHeight, widthPx, style);
    if (best < 0) {
      return SplitResult.nothingFits(HtmlFragments.outerHtml(element));
    }

    int chosen = best;
    while (chosen >= 0 && AVOID_BREAK_AFTER.indexOf(text.charAt(candidates.get(chosen) - 1)) >= 0) {
      chosen--;
    }
    int boundary = candidates.get(chosen >= 0 ? chosen : best);
    return new SplitResult(
        HtmlTextCutter.prefix(element, boundary),
        HtmlTextCutter.suffix(element, boundary),
        boundary,
        SplitBoundary.WORD);
  }

  /** Index of the largest boundary whose prefix fits, or -1. */
  private int largestFitting(
      Element element,
      List<Integer> boundaries,
      double maxHeight,
      double widthPx,
      StyleContext style) {
    int low = 0;
    int high = boundaries.size() - 1;
    int best = -1;
    while (low <= high) {
      int mid = (low + high) >>> 1;
      String prefix = HtmlTextCutter.prefix(element, boundaries.get(mid));
      if (fits(prefix, maxHeight, widthPx, style)) {
        best = mid;
        low = mid + 1;
      } else {
        high = mid - 1;
      }
    }
    return best;
  }

  private boolean fits(String html, double maxHeight, double widthPx, StyleContext style) {
    return oracle.measureHeight(html, widthPx, style) <= maxHeight + fitTolerance;
  }

  private static List<int[]> footnoteMarkerRanges(String text) {
    List<int[]> ranges = new ArrayList<>();
    Matcher matcher = FootnoteMarkers.INLINE_MARKER.matcher(text);
    while (matcher.find()) {
      ranges.add(new int[] {matcher.start(), matcher.end()});
    }
    return ranges;
  }

  private static boolean isProtected(int position, List<int[]> ranges) {
    for (int[] range : ranges) {
      if (position > range[0] && position < range[1]) {
        return true;
      }
    }
    return false;
  }

  /** Number of whitespace-separated words in the text of an HTML fragment. */
  public static int wordCount(String html) {
    if (html == null) {
      return 0;
    }
    String text = HtmlFragments.rawText(HtmlFragments.parseBody(html)).strip();
    return text.isEmpty() ? 0 : text.split("\\s+").length;
  }
}
