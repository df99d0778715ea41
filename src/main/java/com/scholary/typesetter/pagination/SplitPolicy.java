package com.scholary.typesetter.pagination;

import com.scholary.typesetter.config.TypesetterProperties.SplitThresholds;

/**
 * Decides whether a paragraph is split, kept whole with a small overflow, or moved to the next
 * page.
 *
 * <p>Each branch uses its own thresholds, named individually in {@link SplitThresholds}.
 */
public class SplitPolicy {

  /** What to do with a split whose first part was measured on the current page. */
  public enum FirstPartVerdict {
    SPLIT,
    KEEP_WHOLE,
    DEFER_WHOLE
  }

  /**
   * Measurements of a paragraph that fits the content area.
   *
   * @param textLength characters of text in the paragraph
   * @param remaining content height left on the page before the paragraph
   * @param finalTotal height of the page wrapper with the paragraph and its bottom reserve
   * @param availableHeight content height of the page
   * @param overflow how far the wrapped page exceeds the page
   * @param standaloneFirstPage whether this is the first page chapter's first page
   * @param lastElement whether the paragraph is the last element of its block
   */
  public record FitMeasurement(
      int textLength,
      double remaining,
      double finalTotal,
      double availableHeight,
      double overflow,
      boolean standaloneFirstPage,
      boolean lastElement) {}

  private final SplitThresholds thresholds;

  public SplitPolicy(SplitThresholds thresholds) {
    this.thresholds = thresholds;
  }

  public SplitThresholds thresholds() {
    return thresholds;
  }

  public boolean shouldSplitFittingElement(FitMeasurement m) {
    boolean triggered =
        m.overflow() >= thresholds.splitTriggerOverflow()
            || (m.remaining() < thresholds.smallSpaceRemaining()
                && m.remaining() > 0
                && m.textLength() > thresholds.smallSpaceMinTextLength());
    return triggered
        && m.finalTotal() > m.availableHeight()
        && !allowsSmallOverflow(m)
        && !isTinySpaceForLongText(m.remaining(), m.textLength());
  }

  /** A small overflow is tolerated at the end of a block, near the page end and for short text. */
  public boolean allowsSmallOverflow(FitMeasurement m) {
    double tolerance = thresholds.overflowTolerance();
    boolean eligible =
        m.lastElement()
            || (m.remaining() < thresholds.likelyLastRemaining() && m.overflow() < tolerance)
            || (m.textLength() < thresholds.shortTextLength() && m.overflow() < tolerance)
            || m.standaloneFirstPage();
    double limit =
        m.standaloneFirstPage() ? thresholds.firstPageOverflowTolerance() : tolerance;
    return eligible && m.overflow() < limit && m.overflow() > 0;
  }

  /** A paragraph that does not fit goes whole to the next page instead of being split. */
  public boolean shouldDeferInsteadOfSplitting(double remaining, int textLength) {
    return isTinySpaceForLongText(remaining, textLength);
  }

  /** A first part with fewer words than the minimum would be left alone at the page bottom. */
  public boolean isOrphanFirstPart(int firstPartWords) {
    return firstPartWords < thresholds.minFirstPartWords();
  }

  public FirstPartVerdict judgeFirstPart(
      int firstPartWords, double firstPartRemaining, double overflow) {
    if (isOrphanFirstPart(firstPartWords)) {
      return FirstPartVerdict.DEFER_WHOLE;
    }
    if (firstPartRemaining > thresholds.firstPartUnderfill()
        && overflow < thresholds.overflowTolerance()) {
      return FirstPartVerdict.KEEP_WHOLE;
    }
    if (firstPartRemaining < thresholds.firstPartNearFull()
        && overflow < thresholds.overflowTolerance()) {
      return FirstPartVerdict.DEFER_WHOLE;
    }
    return FirstPartVerdict.SPLIT;
  }

  public double safetyMargin(boolean hasHeading) {
    return hasHeading ? thresholds.headingSafetyMargin() : thresholds.safetyMargin();
  }

  public double fitTolerance() {
    return thresholds.fitTolerance();
  }

  private boolean isTinySpaceForLongText(double remaining, int textLength) {
    return remaining < thresholds.tinyRemaining()
        && remaining > 0
        && textLength > thresholds.longTextLength();
  }
}
