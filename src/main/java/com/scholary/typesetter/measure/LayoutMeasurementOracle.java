package com.scholary.typesetter.measure;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Measurement oracle that lays fragments out with a simplified block model.
 *
 * <p>The fragment is parsed into a fresh jsoup document for every call, so no layout state
 * survives between measurements. Layout rules:
 *
 * <ul>
 *   <li>Block children stack vertically; adjacent vertical margins collapse to the larger one
 *   <li>Margins of the first and last child collapse through the probe and are not counted
 *   <li>Inline content wraps greedily using the configured {@link TextWidthMeter}
 *   <li>Images and videos scale to the content width, keeping their aspect ratio
 *   <li>Poetry, dinkus, karaoke, footnote and page wrapper blocks use the reader's stylesheet
 *       values
 * </ul>
 */
public class LayoutMeasurementOracle implements MeasurementOracle {

  private static final double ROOT_FONT_PX = 16.0;
  private static final double[] HEADING_SCALE = {2.0, 1.6, 1.35, 1.2, 1.1, 1.0};
  private static final double HEADING_LINE_HEIGHT = 1.2;
  private static final double HEADING_MARGIN_EM = 0.67;
  private static final double POETRY_LINE_HEIGHT = 1.6;
  private static final double POETRY_LINE_MARGIN_EM = 0.3;
  private static final double POETRY_BLOCK_MARGIN_EM = 0.8;
  private static final double KARAOKE_MARGIN_BOTTOM = 0.85 * ROOT_FONT_PX;
  private static final double FOOTNOTE_FONT_PX = 0.9 * ROOT_FONT_PX;
  private static final double FOOTNOTE_LINE_HEIGHT = 1.5;
  private static final double FOOTNOTE_VERTICAL_PADDING = ROOT_FONT_PX;
  private static final double FOOTNOTE_HORIZONTAL_PADDING = 1.5 * ROOT_FONT_PX;
  private static final double FOOTNOTE_DIVIDER_HEIGHT = 1;
  private static final double FOOTNOTE_DIVIDER_MARGIN = 0.5 * ROOT_FONT_PX;
  private static final double FOOTNOTE_ITEM_MARGIN = 0.25 * ROOT_FONT_PX;
  private static final double VIDEO_ASPECT = 9.0 / 16.0;
  private static final char FORCED_BREAK = '\u2028';

  private static final Set<String> BLOCK_TAGS =
      Set.of(
          "p", "div", "h1", "h2", "h3", "h4", "h5", "h6", "blockquote", "ul", "ol", "li",
          "figure", "figcaption", "section", "article", "aside", "header", "footer", "pre", "hr",
          "img", "video", "iframe", "table");

  private static final Pattern FOOTNOTE_MARKER = Pattern.compile("\\^\\[[^\\]]+\\]");
  private static final Pattern PADDING_BOTTOM =
      Pattern.compile("padding-bottom\\s*:\\s*([0-9.]+)px");

  private final LineWrapper wrapper;

  public LayoutMeasurementOracle(TextWidthMeter meter) {
    this.wrapper = new LineWrapper(meter);
  }

  @Override
  public double measureHeight(String htmlFragment, double widthPx, StyleContext style) {
    if (!(widthPx > 0)) {
      throw new MeasurementException("Probe width must be positive: " + widthPx);
    }
    if (htmlFragment == null || htmlFragment.isBlank()) {
      return 0;
    }
    Element probe = Jsoup.parseBodyFragment(htmlFragment).body();
    Box box = layoutFlow(probe, widthPx, style, Typeface.body(style));
    return Math.ceil(box.height() - 1e-6);
  }

  private Box layoutFlow(Element container, double width, StyleContext style, Typeface face) {
    List<Box> boxes = new ArrayList<>();
    StringBuilder inline = new StringBuilder();
    for (Node child : container.childNodes()) {
      if (child instanceof Element element && isBlock(element)) {
        flushInline(inline, boxes, width, face);
        boxes.add(layoutBlock(element, width, style, face));
      } else {
        collectInline(child, inline, boxes, width, style, face);
      }
    }
    flushInline(inline, boxes, width, face);
    return stack(boxes);
  }

  private void collectInline(
      Node node,
      StringBuilder inline,
      List<Box> boxes,
      double width,
      StyleContext style,
      Typeface face) {
    if (node instanceof TextNode text) {
      inline.append(text.getWholeText());
    } else if (node instanceof Element element) {
      String tag = element.normalName();
      if ("br".equals(tag)) {
        inline.append(FORCED_BREAK);
      } else if ("img".equals(tag) || "video".equals(tag) || "iframe".equals(tag)) {
        flushInline(inline, boxes, width, face);
        boxes.add(layoutBlock(element, width, style, face));
      } else {
        for (Node child : element.childNodes()) {
          collectInline(child, inline, boxes, width, style, face);
        }
      }
    }
  }

  private void flushInline(StringBuilder inline, List<Box> boxes, double width, Typeface face) {
    if (inline.length() == 0) {
      return;
    }
    String text = normalizeWhitespace(inline.toString(), face.preserveNewlines());
    inline.setLength(0);
    if (text.isBlank()) {
      return;
    }
    int lines = wrapper.countLines(text, width, face.fontSizePx(), face.italic());
    boxes.add(new Box(lines * face.lineHeightPx(), 0, 0));
  }

  private Box layoutBlock(Element element, double width, StyleContext style, Typeface face) {
    String tag = element.normalName();

    if (tag.length() == 2 && tag.charAt(0) == 'h' && Character.isDigit(tag.charAt(1))) {
      int level = Math.min(6, Math.max(1, tag.charAt(1) - '0'));
      Typeface heading = face.heading(HEADING_SCALE[level - 1], HEADING_LINE_HEIGHT);
      Box inner = layoutFlow(element, width, style, heading);
      double margin = heading.fontSizePx() * HEADING_MARGIN_EM;
      return new Box(inner.height(), margin, margin);
    }
    if ("img".equals(tag)) {
      return new Box(imageHeight(element, width, style), 0, 0);
    }
    if ("video".equals(tag) || "iframe".equals(tag)) {
      return new Box(videoHeight(element, width), 0, 0);
    }
    if ("hr".equals(tag)) {
      return new Box(1, face.fontSizePx() / 2, face.fontSizePx() / 2);
    }
    if (element.hasClass("poetry")) {
      Typeface poem =
          face.poetry(POETRY_LINE_HEIGHT, POETRY_LINE_MARGIN_EM * face.fontSizePx());
      Box inner = layoutFlow(element, Math.max(1, width - 2 * face.fontSizePx()), style, poem);
      double margin = POETRY_BLOCK_MARGIN_EM * face.fontSizePx();
      return new Box(inner.height(), margin, margin);
    }
    if (element.hasClass("dinkus")) {
      Element image = element.selectFirst("img");
      if (image != null) {
        return new Box(imageHeight(image, width, style), face.fontSizePx(), face.fontSizePx());
      }
      return new Box(face.lineHeightPx(), face.fontSizePx(), face.fontSizePx());
    }
    if (element.hasClass("karaoke-block")) {
      Box inner = layoutFlow(element, width, style, face.preserving());
      return new Box(inner.height(), 0, KARAOKE_MARGIN_BOTTOM);
    }
    if (element.hasClass("footnotes-section")) {
      Box inner =
          layoutFlow(
              element, Math.max(1, width - 2 * FOOTNOTE_HORIZONTAL_PADDING), style,
              face.footnotes(FOOTNOTE_FONT_PX, FOOTNOTE_LINE_HEIGHT, FOOTNOTE_ITEM_MARGIN));
      double height =
          FOOTNOTE_VERTICAL_PADDING
              + inner.marginTop()
              + inner.height()
              + inner.marginBottom()
              + FOOTNOTE_VERTICAL_PADDING;
      return new Box(height, 0, 0);
    }
    if (element.hasClass("footnotes-divider")) {
      return new Box(FOOTNOTE_DIVIDER_HEIGHT, 0, FOOTNOTE_DIVIDER_MARGIN);
    }
    if (element.hasClass("page-content-main")) {
      Box inner = layoutFlow(element, width, style, face);
      double height = inner.height() + inner.marginBottom() + paddingBottom(element);
      return new Box(height, inner.marginTop(), 0);
    }
    if ("p".equals(tag) || "li".equals(tag) || element.hasClass("footnote-item")) {
      double indent = "li".equals(tag) && !face.footnoteList() ? 1.5 * face.fontSizePx() : 0;
      Box inner = layoutFlow(element, Math.max(1, width - indent), style, face);
      return new Box(inner.height(), face.paragraphMarginPx(), face.paragraphMarginPx());
    }
    if ("blockquote".equals(tag)) {
      Box inner = layoutFlow(element, Math.max(1, width - 2 * face.fontSizePx()), style, face);
      return new Box(
          inner.height(),
          Math.max(face.fontSizePx(), inner.marginTop()),
          Math.max(face.fontSizePx(), inner.marginBottom()));
    }
    if (("ul".equals(tag) || "ol".equals(tag)) && !face.footnoteList()) {
      Box inner = layoutFlow(element, width, style, face);
      return new Box(
          inner.height(),
          Math.max(face.fontSizePx(), inner.marginTop()),
          Math.max(face.fontSizePx(), inner.marginBottom()));
    }
    Box inner = layoutFlow(element, width, style, face);
    return new Box(inner.height(), inner.marginTop(), inner.marginBottom());
  }

  private double imageHeight(Element image, double width, StyleContext style) {
    int declaredWidth = parseDimension(image.attr("width"));
    int declaredHeight = parseDimension(image.attr("height"));
    if (declaredWidth > 0 && declaredHeight > 0) {
      return new ImageDimensions(declaredWidth, declaredHeight).heightAt(width);
    }
    ImageDimensions known = style.imageDimensions().get(image.attr("src"));
    if (known != null) {
      return known.heightAt(width);
    }
    return width * style.defaultImageAspectRatio();
  }

  private double videoHeight(Element video, double width) {
    int declaredWidth = parseDimension(video.attr("width"));
    int declaredHeight = parseDimension(video.attr("height"));
    if (declaredWidth > 0 && declaredHeight > 0) {
      return new ImageDimensions(declaredWidth, declaredHeight).heightAt(width);
    }
    return width * VIDEO_ASPECT;
  }

  private static double paddingBottom(Element element) {
    Matcher matcher = PADDING_BOTTOM.matcher(element.attr("style"));
    return matcher.find() ? Double.parseDouble(matcher.group(1)) : 0;
  }

  private static int parseDimension(String value) {
    if (value == null || value.isBlank()) {
      return 0;
    }
    String digits = value.trim().replace("px", "");
    try {
      return (int) Math.round(Double.parseDouble(digits));
    } catch (NumberFormatException e) {
      return 0;
    }
  }

  private static boolean isBlock(Element element) {
    return BLOCK_TAGS.contains(element.normalName())
        || element.hasClass("karaoke-block")
        || element.hasClass("footnotes-section");
  }

  /**
   * Apply white-space processing. Footnote markers render as a single superscript digit, soft
   * hyphens are invisible.
   */
  static String normalizeWhitespace(String raw, boolean preserveNewlines) {
    String text = FOOTNOTE_MARKER.matcher(raw).replaceAll("0").replace("\u00AD", "");
    if (preserveNewlines) {
      return text.replace("\r\n", "\n").replace(FORCED_BREAK, '\n');
    }
    text = text.replaceAll("\\s+", " ");
    text = text.replaceAll(" ?" + FORCED_BREAK + " ?", "\n");
    return text.strip();
  }

  private static Box stack(List<Box> boxes) {
    if (boxes.isEmpty()) {
      return new Box(0, 0, 0);
    }
    double height = 0;
    Box previous = null;
    for (Box box : boxes) {
      if (previous != null) {
        height += Math.max(previous.marginBottom(), box.marginTop());
      }
      height += box.height();
      previous = box;
    }
    return new Box(height, boxes.get(0).marginTop(), previous.marginBottom());
  }

  /** Laid-out block: border-box height and its outer vertical margins. */
  private record Box(double height, double marginTop, double marginBottom) {}

  /** Inherited text properties. */
  private record Typeface(
      double fontSizePx,
      double lineHeightPx,
      boolean italic,
      boolean preserveNewlines,
      double paragraphMarginPx,
      boolean footnoteList) {

    static Typeface body(StyleContext style) {
      return new Typeface(
          style.fontSizePx(),
          style.lineHeightPx(),
          false,
          false,
          style.paragraphMarginPx(),
          false);
    }

    Typeface heading(double scale, double lineHeight) {
      double size = fontSizePx * scale;
      return new Typeface(
          size, size * lineHeight, italic, preserveNewlines, paragraphMarginPx, footnoteList);
    }

    Typeface poetry(double lineHeight, double lineMargin) {
      return new Typeface(
          fontSizePx, fontSizePx * lineHeight, true, preserveNewlines, lineMargin, footnoteList);
    }

    Typeface preserving() {
      return new Typeface(
          fontSizePx, lineHeightPx, italic, true, paragraphMarginPx, footnoteList);
    }

    Typeface footnotes(double size, double lineHeight, double itemMargin) {
      return new Typeface(size, size * lineHeight, false, false, itemMargin, true);
    }
  }
}
