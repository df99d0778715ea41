package com.scholary.typesetter.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for pagination and karaoke playback.
 *
 * <p>Every split heuristic lives in {@link SplitThresholds} as a named value. The thresholds differ
 * between branches on purpose and are kept apart rather than merged into one tolerance.
 */
@ConfigurationProperties(prefix = "typesetter")
@Validated
public record TypesetterProperties(
    @Valid @NotNull PageProperties page,
    @Valid @NotNull TypographyProperties typography,
    @Valid @NotNull MarginProperties margins,
    @Valid @NotNull SplitThresholds thresholds,
    @Valid @NotNull KaraokeProperties karaoke,
    @Valid @NotNull ImageProperties images,
    @Valid @NotNull HyphenationProperties hyphenation,
    @Valid @NotNull RunStoreProperties runs,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize) {

  public record PageProperties(
      @Positive double documentWidth,
      @Positive double documentHeight,
      @Positive double deviceWidth,
      @Positive double deviceHeight,
      @Positive double maxSheetWidth,
      @PositiveOrZero double deviceHorizontalPadding,
      @PositiveOrZero double paddingTop,
      @PositiveOrZero double paddingBottom,
      @PositiveOrZero double headingPadding) {

    public static PageProperties defaults() {
      return new PageProperties(800, 1000, 390, 844, 680, 24, 32, 8, 40);
    }
  }

  public record TypographyProperties(
      @NotBlank String fontFamily,
      @Positive double fontSizePx,
      @Positive double lineHeight,
      @PositiveOrZero double paragraphMarginPx,
      @NotNull TextMeter textMeter,
      @Positive double fixedAdvanceEm) {

    public enum TextMeter {
      AWT,
      FIXED
    }

    public static TypographyProperties defaults() {
      return new TypographyProperties("Serif", 20.8, 1.35, 5.6, TextMeter.AWT, 0.5);
    }
  }

  /**
   * Bottom space reserved on pages without footnotes.
   *
   * <p>The calculation margin (32) is smaller than the padding actually applied to prose pages
   * (48); pages are filled against the smaller value.
   */
  public record MarginProperties(
      @PositiveOrZero double calculationBottomMargin,
      @PositiveOrZero double firstPageBottomMargin,
      @PositiveOrZero double prosePagePadding,
      @PositiveOrZero double karaokePagePadding,
      @PositiveOrZero double footnoteExtraPadding) {

    public static MarginProperties defaults() {
      return new MarginProperties(32, 20, 48, 32, 16);
    }
  }

  public record SplitThresholds(
      @PositiveOrZero double splitTriggerOverflow,
      @PositiveOrZero double smallSpaceRemaining,
      @PositiveOrZero int smallSpaceMinTextLength,
      @PositiveOrZero double likelyLastRemaining,
      @PositiveOrZero double overflowTolerance,
      @PositiveOrZero double firstPageOverflowTolerance,
      @PositiveOrZero int shortTextLength,
      @PositiveOrZero double tinyRemaining,
      @PositiveOrZero int longTextLength,
      @PositiveOrZero double firstPartUnderfill,
      @PositiveOrZero double firstPartNearFull,
      @Positive int minFirstPartWords,
      @PositiveOrZero double fitTolerance,
      @PositiveOrZero double safetyMargin,
      @PositiveOrZero double headingSafetyMargin) {

    public static SplitThresholds defaults() {
      return new SplitThresholds(10, 50, 50, 80, 30, 50, 100, 20, 200, 30, 15, 2, 2, 2, 8);
    }
  }

  public record KaraokeProperties(
      @Positive int minForcedChunkChars,
      @Positive int maxInitAttempts,
      @Positive long frameIntervalMs) {

    public static KaraokeProperties defaults() {
      return new KaraokeProperties(80, 10, 16);
    }
  }

  public record ImageProperties(
      @Positive long waitTimeoutMs,
      @Positive long requestTimeoutMs,
      @Positive double defaultAspectRatio) {

    public static ImageProperties defaults() {
      return new ImageProperties(5000, 3000, 0.5625);
    }
  }

  public record HyphenationProperties(
      boolean enabled,
      @Positive int minWordLength,
      @Positive int minPrefix,
      @Positive int minSuffix,
      @NotBlank String patterns) {

    public static HyphenationProperties defaults() {
      return new HyphenationProperties(true, 7, 3, 3, "hyph/en.hyp");
    }
  }

  public record RunStoreProperties(@Positive int maxSize, @Positive int expireAfterMinutes) {}
}
