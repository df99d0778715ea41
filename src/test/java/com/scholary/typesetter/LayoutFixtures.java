package com.scholary.typesetter;

import com.scholary.typesetter.config.TypesetterProperties;
import com.scholary.typesetter.config.TypesetterProperties.HyphenationProperties;
import com.scholary.typesetter.config.TypesetterProperties.ImageProperties;
import com.scholary.typesetter.config.TypesetterProperties.KaraokeProperties;
import com.scholary.typesetter.config.TypesetterProperties.MarginProperties;
import com.scholary.typesetter.config.TypesetterProperties.PageProperties;
import com.scholary.typesetter.config.TypesetterProperties.RunStoreProperties;
import com.scholary.typesetter.config.TypesetterProperties.SplitThresholds;
import com.scholary.typesetter.config.TypesetterProperties.TypographyProperties;
import com.scholary.typesetter.config.TypesetterProperties.TypographyProperties.TextMeter;
import com.scholary.typesetter.content.ChapterRecord;
import com.scholary.typesetter.measure.FixedAdvanceTextWidthMeter;
import com.scholary.typesetter.measure.LayoutMeasurementOracle;
import com.scholary.typesetter.measure.MeasurementOracle;
import com.scholary.typesetter.measure.PageGeometry;
import com.scholary.typesetter.measure.StyleContext;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic layout used across tests.
 *
 * <p>Font size 20px, line height 1.0, no paragraph margins and a fixed advance of 0.5em, so every
 * character is 10px wide and every line 20px tall. The document page is 200x300 without container
 * padding: 20 characters per line, a 300px body and 268px available once the 32px calculation
 * margin is reserved.
 */
public final class LayoutFixtures {

  public static final double PAGE_WIDTH = 200;
  public static final double PAGE_HEIGHT = 300;

  private LayoutFixtures() {}

  public static TypesetterProperties properties() {
    return new TypesetterProperties(
        new PageProperties(PAGE_WIDTH, PAGE_HEIGHT, 390, 844, 680, 24, 0, 0, 40),
        new TypographyProperties("Serif", 20, 1.0, 0, TextMeter.FIXED, 0.5),
        MarginProperties.defaults(),
        SplitThresholds.defaults(),
        new KaraokeProperties(80, 3, 16),
        ImageProperties.defaults(),
        HyphenationProperties.defaults(),
        new RunStoreProperties(10, 5),
        2,
        10);
  }

  public static MeasurementOracle oracle() {
    return new LayoutMeasurementOracle(new FixedAdvanceTextWidthMeter(0.5));
  }

  public static StyleContext style() {
    TypesetterProperties properties = properties();
    return StyleContext.of(properties.typography(), properties.images());
  }

  public static PageGeometry geometry() {
    return PageGeometry.document(properties().page());
  }

  /** {@code count} copies of {@code word} separated by single spaces. */
  public static String words(int count, String word) {
    return String.join(" ", Collections.nCopies(count, word));
  }

  public static ChapterRecord chapter(String id, Integer order, String html) {
    return new ChapterRecord(id, "Chapter " + id, html, null, null, order, false, false, List.of());
  }

  public static ChapterRecord cover(String id, String html) {
    return new ChapterRecord(id, "Cover", html, null, null, null, true, false, List.of());
  }

  public static ChapterRecord firstPage(String id, String html) {
    return new ChapterRecord(id, "First page", html, null, null, null, false, true, List.of());
  }

  /** Karaoke block carrying its payload as raw JSON. */
  public static String karaokeBlock(String id, String text, double secondsPerWord) {
    StringBuilder timings = new StringBuilder();
    String[] tokens = text.split("\\s+");
    for (int i = 0; i < tokens.length; i++) {
      if (i > 0) {
        timings.append(',');
      }
      timings.append(
          String.format(
              Locale.ROOT,
              "{\"word\":\"%s\",\"start\":%.3f,\"end\":%.3f}",
              tokens[i],
              i * secondsPerWord,
              (i + 1) * secondsPerWord));
    }
    String payload =
        "{\"type\":\"karaoke\",\"text\":\""
            + text
            + "\",\"audioUrl\":\"https://cdn.example.com/"
            + id
            + ".mp3\",\"wordTimings\":["
            + timings
            + "]}";
    return "<div class=\"karaoke-object\" data-karaoke-id=\""
        + id
        + "\" data-karaoke='"
        + payload
        + "'></div>";
  }
}
