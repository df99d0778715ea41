package com.scholary.typesetter.measure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.typesetter.LayoutFixtures;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LayoutMeasurementOracleTest {

  private MeasurementOracle oracle;
  private StyleContext style;

  @BeforeEach
  void setUp() {
    oracle = LayoutFixtures.oracle();
    style = LayoutFixtures.style();
  }

  @Test
  void measureHeight_shouldWrapParagraphToLines() {
    // four 4-letter words fit a 200px line, the fifth wraps
    String html = "<p>" + LayoutFixtures.words(9, "abcd") + "</p>";

    assertThat(oracle.measureHeight(html, 200, style)).isEqualTo(60);
  }

  @Test
  void measureHeight_shouldReturnZeroForBlankFragment() {
    assertThat(oracle.measureHeight("", 200, style)).isZero();
    assertThat(oracle.measureHeight("   ", 200, style)).isZero();
  }

  @Test
  void measureHeight_shouldRejectNonPositiveWidth() {
    assertThatThrownBy(() -> oracle.measureHeight("<p>x</p>", 0, style))
        .isInstanceOf(MeasurementException.class)
        .hasMessageContaining("width");
  }

  @Test
  void measureHeight_shouldCollapseAdjacentMargins() {
    StyleContext spaced =
        new StyleContext("Serif", 20, 1.0, 10, 0.5625, Map.of());

    // outer margins collapse through the probe, the inner pair collapses to 10
    double height = oracle.measureHeight("<p>one</p><p>two</p>", 200, spaced);

    assertThat(height).isEqualTo(50);
  }

  @Test
  void measureHeight_shouldScaleImageWithDeclaredSize() {
    String html = "<img src=\"a.png\" width=\"400\" height=\"300\">";

    assertThat(oracle.measureHeight(html, 200, style)).isEqualTo(150);
  }

  @Test
  void measureHeight_shouldUseProbedImageSize() {
    StyleContext withImages =
        style.withImageDimensions(Map.of("b.png", new ImageDimensions(100, 200)));

    // narrower than the content width, drawn at its natural size
    assertThat(oracle.measureHeight("<img src=\"b.png\">", 200, withImages)).isEqualTo(200);
  }

  @Test
  void measureHeight_shouldFallBackToDefaultAspectRatio() {
    assertThat(oracle.measureHeight("<img src=\"unknown.png\">", 200, style)).isEqualTo(113);
  }

  @Test
  void measureHeight_shouldAddWrapperPaddingBottom() {
    String html =
        "<div class=\"page-content-main\" style=\"padding-bottom: 32px;\"><p>abcd</p></div>";

    assertThat(oracle.measureHeight(html, 200, style)).isEqualTo(52);
  }

  @Test
  void measureHeight_shouldKeepNewlinesInKaraokeBlock() {
    String html = "<div class=\"karaoke-block\">one\ntwo\nthree</div>";

    assertThat(oracle.measureHeight(html, 200, style)).isEqualTo(60);
  }

  @Test
  void measureHeight_shouldCountLineBreaks() {
    assertThat(oracle.measureHeight("<p>one<br>two</p>", 200, style)).isEqualTo(40);
  }

  @Test
  void measureHeight_shouldTreatFootnoteMarkerAsSingleCharacter() {
    // 17 characters plus the marker still fit a single line
    String html = "<p>abcdefghijklmnopq^[a long footnote text]</p>";

    assertThat(oracle.measureHeight(html, 200, style)).isEqualTo(20);
  }

  @Test
  void normalizeWhitespace_shouldDropSoftHyphens() {
    assertThat(LayoutMeasurementOracle.normalizeWhitespace("pagi\u00ADnation", false))
        .isEqualTo("pagination");
  }
}
