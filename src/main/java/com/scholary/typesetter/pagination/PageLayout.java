package com.scholary.typesetter.pagination;

import com.scholary.typesetter.config.TypesetterProperties.MarginProperties;
import com.scholary.typesetter.measure.MeasurementOracle;
import com.scholary.typesetter.measure.PageGeometry;
import com.scholary.typesetter.measure.PageMode;
import com.scholary.typesetter.measure.StyleContext;
import java.math.BigDecimal;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Page arithmetic for one run: body height, bottom reserves, available height and content
 * measurement through the oracle.
 */
public class PageLayout {

  private static final Logger LOGGER = LoggerFactory.getLogger(PageLayout.class);

  static final String CONTENT_WRAPPER_CLASS = "page-content-main";
  private static final double DOCUMENT_FOOTNOTE_INSET = 60;

  private final MeasurementOracle oracle;
  private final PageGeometry geometry;
  private final StyleContext style;
  private final MarginProperties margins;

  public PageLayout(
      MeasurementOracle oracle,
      PageGeometry geometry,
      StyleContext style,
      MarginProperties margins) {
    this.oracle = oracle;
    this.geometry = geometry;
    this.style = style;
    this.margins = margins;
  }

  public PageGeometry geometry() {
    return geometry;
  }

  public StyleContext style() {
    return style;
  }

  public MarginProperties margins() {
    return margins;
  }

  public double contentWidth() {
    return geometry.contentWidth();
  }

  public double bodyHeight() {
    return geometry.bodyHeight();
  }

  /** Width the footnote section is laid out in. */
  public double footnoteSectionWidth() {
    if (geometry.mode() == PageMode.DOCUMENT) {
      return Math.max(1, geometry.pageWidth() - DOCUMENT_FOOTNOTE_INSET);
    }
    return geometry.contentWidth();
  }

  /** Footnotes replace the bottom margin; without footnotes the calculation margin applies. */
  public double bottomReserve(double footnotesHeight, boolean standaloneFirstPage) {
    if (footnotesHeight > 0) {
      return footnotesHeight;
    }
    return standaloneFirstPage
        ? margins.firstPageBottomMargin()
        : margins.calculationBottomMargin();
  }

  public double karaokeReserve(double footnotesHeight) {
    return footnotesHeight > 0 ? footnotesHeight : margins.karaokePagePadding();
  }

  /**
   * Height left for content once the reserve and heading padding are taken off the body.
   *
   * <p>A non-positive result falls back to the body minus the default bottom margin.
   */
  public double availableHeight(double reserve, boolean hasHeading) {
    double available = bodyHeight() - reserve - (hasHeading ? geometry.headingPadding() : 0);
    if (available > 0) {
      return available;
    }
    double degraded = Math.max(0, bodyHeight() - margins.calculationBottomMargin());
    LOGGER.warn(
        "Available height not positive, using default bottom margin: reserve={}px, heading={},"
            + " degraded={}px",
        reserve,
        hasHeading,
        degraded);
    return degraded;
  }

  /** Height of elements stacked in the content area. */
  public double measure(List<String> elements) {
    if (elements.isEmpty()) {
      return 0;
    }
    return oracle.measureHeight(String.join("", elements), contentWidth(), style);
  }

  /** Height of elements inside the page wrapper with the given bottom padding. */
  public double measureWrapped(List<String> elements, double paddingBottom) {
    String html = wrap(String.join("", elements), paddingBottom);
    return oracle.measureHeight(html, contentWidth(), style);
  }

  public double measureFragment(String html) {
    return oracle.measureHeight(html, contentWidth(), style);
  }

  static String wrap(String html, double paddingBottom) {
    return "<div class=\""
        + CONTENT_WRAPPER_CLASS
        + "\" style=\"padding-bottom: "
        + px(paddingBottom)
        + ";\">"
        + html
        + "</div>";
  }

  /** CSS pixel value without a trailing fraction for whole numbers. */
  static String px(double value) {
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString() + "px";
  }
}
