package com.scholary.typesetter.measure;

/**
 * Renders an HTML fragment into a throwaway probe and reports its height.
 *
 * <p>Implementations must apply the same typography the page renderer uses, so that a measured
 * height matches the displayed height within a couple of pixels. Calls are independent: nothing
 * measured in one call may influence the next.
 */
public interface MeasurementOracle {

  /**
   * Measure the rendered height of a fragment.
   *
   * @param htmlFragment HTML to lay out, may contain several top-level blocks
   * @param widthPx content width of the probe
   * @param style typography and known image sizes
   * @return height in pixels, rounded up to whole pixels
   */
  double measureHeight(String htmlFragment, double widthPx, StyleContext style);
}
