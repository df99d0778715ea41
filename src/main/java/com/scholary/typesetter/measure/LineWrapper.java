package com.scholary.typesetter.measure;

/**
 * Greedy line breaking over measured word widths.
 *
 * <p>Input text has already had its whitespace processed: {@code '\n'} is a forced break and
 * spaces separate words. Words wider than the line are broken between characters, the way a
 * browser breaks an unbreakable token with {@code overflow-wrap: break-word}.
 */
public class LineWrapper {

  private final TextWidthMeter meter;

  public LineWrapper(TextWidthMeter meter) {
    this.meter = meter;
  }

  /** Count rendered lines for the given text. Blank text occupies no lines. */
  public int countLines(String text, double widthPx, double fontSizePx, boolean italic) {
    if (text.isEmpty()) {
      return 0;
    }
    String body =
        text.endsWith("\n") && text.length() > 1 ? text.substring(0, text.length() - 1) : text;
    int lines = 0;
    for (String hardLine : body.split("\n", -1)) {
      lines += wrap(hardLine, widthPx, fontSizePx, italic);
    }
    return lines;
  }

  private int wrap(String line, double widthPx, double fontSizePx, boolean italic) {
    String content = line.stripTrailing();
    if (content.isEmpty()) {
      return 1;
    }
    double spaceWidth = meter.width(" ", fontSizePx, italic);
    int lines = 1;
    double x = 0;
    boolean lineStarted = false;

    for (String word : content.split(" ", -1)) {
      if (word.isEmpty()) {
        // consecutive spaces in preserved text
        x += spaceWidth;
        continue;
      }
      double wordWidth = meter.width(word, fontSizePx, italic);
      double needed = lineStarted ? x + spaceWidth + wordWidth : x + wordWidth;

      if (needed <= widthPx) {
        x = needed;
        lineStarted = true;
        continue;
      }
      if (lineStarted) {
        lines++;
        x = 0;
      }
      if (wordWidth <= widthPx) {
        x = wordWidth;
      } else {
        int extra = (int) Math.ceil(wordWidth / widthPx) - 1;
        lines += extra;
        x = wordWidth - extra * widthPx;
      }
      lineStarted = true;
    }
    return lines;
  }
}
