package com.scholary.typesetter.measure;

/** Measures the advance width of a run of text. */
public interface TextWidthMeter {

  double width(String text, double fontSizePx, boolean italic);
}
