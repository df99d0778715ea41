package com.scholary.typesetter.measure;

import com.scholary.typesetter.config.TypesetterProperties.ImageProperties;
import com.scholary.typesetter.config.TypesetterProperties.TypographyProperties;
import java.util.Map;

/**
 * Typography used for measuring, plus the image sizes known for the current run.
 *
 * @param fontFamily body font family
 * @param fontSizePx body font size
 * @param lineHeight body line height as a multiple of the font size
 * @param paragraphMarginPx vertical margin around paragraphs
 * @param defaultImageAspectRatio height/width ratio for images of unknown size
 * @param imageDimensions natural sizes keyed by image source
 */
public record StyleContext(
    String fontFamily,
    double fontSizePx,
    double lineHeight,
    double paragraphMarginPx,
    double defaultImageAspectRatio,
    Map<String, ImageDimensions> imageDimensions) {

  public StyleContext {
    imageDimensions = imageDimensions == null ? Map.of() : Map.copyOf(imageDimensions);
  }

  public static StyleContext of(TypographyProperties typography, ImageProperties images) {
    return new StyleContext(
        typography.fontFamily(),
        typography.fontSizePx(),
        typography.lineHeight(),
        typography.paragraphMarginPx(),
        images.defaultAspectRatio(),
        Map.of());
  }

  public StyleContext withImageDimensions(Map<String, ImageDimensions> dimensions) {
    return new StyleContext(
        fontFamily, fontSizePx, lineHeight, paragraphMarginPx, defaultImageAspectRatio, dimensions);
  }

  public double lineHeightPx() {
    return fontSizePx * lineHeight;
  }
}
