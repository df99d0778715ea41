package com.scholary.typesetter.measure;

/** Natural size of an image in pixels. */
public record ImageDimensions(int width, int height) {

  public ImageDimensions {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException(
          "Image dimensions must be positive: " + width + "x" + height);
    }
  }

  /** Rendered height when the image is drawn at most {@code maxWidth} wide. */
  public double heightAt(double maxWidth) {
    double drawnWidth = Math.min(width, maxWidth);
    return drawnWidth * height / width;
  }
}
