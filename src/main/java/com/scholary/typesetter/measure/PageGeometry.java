package com.scholary.typesetter.measure;

import com.scholary.typesetter.config.TypesetterProperties.PageProperties;

/**
 * Fixed dimensions of a page for one pagination run.
 *
 * @param mode sizing mode
 * @param pageWidth outer page width
 * @param pageHeight outer page height
 * @param contentWidth width available to flowed content
 * @param paddingTop container padding above the body
 * @param paddingBottom container padding below the body
 * @param headingPadding extra space reserved once a page carries a heading
 */
public record PageGeometry(
    PageMode mode,
    double pageWidth,
    double pageHeight,
    double contentWidth,
    double paddingTop,
    double paddingBottom,
    double headingPadding) {

  public PageGeometry {
    if (mode == null) {
      throw new IllegalArgumentException("mode must not be null");
    }
    if (pageWidth <= 0 || pageHeight <= 0 || contentWidth <= 0) {
      throw new IllegalArgumentException(
          String.format(
              "Page dimensions must be positive: width=%.1f, height=%.1f, content=%.1f",
              pageWidth, pageHeight, contentWidth));
    }
    if (paddingTop < 0 || paddingBottom < 0 || headingPadding < 0) {
      throw new IllegalArgumentException("Paddings must not be negative");
    }
  }

  /** Document-sized page; content spans the full page width. */
  public static PageGeometry document(PageProperties page) {
    return new PageGeometry(
        PageMode.DOCUMENT,
        page.documentWidth(),
        page.documentHeight(),
        page.documentWidth(),
        page.paddingTop(),
        page.paddingBottom(),
        page.headingPadding());
  }

  /** Device-sized page; the sheet is capped at the maximum sheet width. */
  public static PageGeometry device(double width, double height, PageProperties page) {
    double sheetWidth = Math.min(page.maxSheetWidth(), width);
    return new PageGeometry(
        PageMode.DEVICE,
        width,
        height,
        Math.max(1, sheetWidth - 2 * page.deviceHorizontalPadding()),
        page.paddingTop(),
        page.paddingBottom(),
        page.headingPadding());
  }

  /** Height of the page body: page height minus container padding. */
  public double bodyHeight() {
    return pageHeight - paddingTop - paddingBottom;
  }
}
