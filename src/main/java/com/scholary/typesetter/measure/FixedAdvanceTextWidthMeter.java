package com.scholary.typesetter.measure;

/**
 * Text meter that gives every character the same advance.
 *
 * <p>Produces identical results on every machine, which makes it the meter of choice for tests
 * and for environments without fonts.
 */
public class FixedAdvanceTextWidthMeter implements TextWidthMeter {

  private final double advanceEm;

  public FixedAdvanceTextWidthMeter(double advanceEm) {
    if (advanceEm <= 0) {
      throw new IllegalArgumentException("advanceEm must be positive: " + advanceEm);
    }
    this.advanceEm = advanceEm;
  }

  @Override
  public double width(String text, double fontSizePx, boolean italic) {
    return text.codePointCount(0, text.length()) * advanceEm * fontSizePx;
  }
}
