package com.scholary.typesetter.measure;

import java.awt.Font;
import java.awt.font.FontRenderContext;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Text meter backed by AWT font metrics.
 *
 * <p>Runs headless. Fonts are derived once per size and style and reused.
 */
public class AwtTextWidthMeter implements TextWidthMeter {

  private static final Logger LOGGER = LoggerFactory.getLogger(AwtTextWidthMeter.class);

  private static final FontRenderContext RENDER_CONTEXT = new FontRenderContext(null, true, true);

  private final Font baseFont;
  private final Map<String, Font> derivedFonts = new ConcurrentHashMap<>();

  public AwtTextWidthMeter(String fontFamily) {
    this.baseFont = new Font(fontFamily, Font.PLAIN, 1);
    LOGGER.info("Using AWT text metrics: family={}, resolved={}", fontFamily, baseFont.getFamily());
  }

  @Override
  public double width(String text, double fontSizePx, boolean italic) {
    if (text.isEmpty()) {
      return 0;
    }
    Font font =
        derivedFonts.computeIfAbsent(
            fontSizePx + (italic ? "i" : "r"),
            key -> baseFont.deriveFont(italic ? Font.ITALIC : Font.PLAIN, (float) fontSizePx));
    return font.getStringBounds(text, RENDER_CONTEXT).getWidth();
  }
}
