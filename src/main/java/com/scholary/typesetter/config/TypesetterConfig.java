package com.scholary.typesetter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.typesetter.config.TypesetterProperties.HyphenationProperties;
import com.scholary.typesetter.config.TypesetterProperties.TypographyProperties;
import com.scholary.typesetter.content.HttpImageDimensionProbe;
import com.scholary.typesetter.content.ImageDimensionProbe;
import com.scholary.typesetter.content.ImageLoadWaiter;
import com.scholary.typesetter.hyphenation.HyphenationPatterns;
import com.scholary.typesetter.hyphenation.Hyphenator;
import com.scholary.typesetter.karaoke.KaraokeSource;
import com.scholary.typesetter.karaoke.KaraokeSourceFactory;
import com.scholary.typesetter.karaoke.WordCharRange;
import com.scholary.typesetter.karaoke.timing.TimingAligner;
import com.scholary.typesetter.karaoke.timing.TimingFileParser;
import com.scholary.typesetter.measure.AwtTextWidthMeter;
import com.scholary.typesetter.measure.FixedAdvanceTextWidthMeter;
import com.scholary.typesetter.measure.LayoutMeasurementOracle;
import com.scholary.typesetter.measure.MeasurementOracle;
import com.scholary.typesetter.measure.TextWidthMeter;
import com.scholary.typesetter.playback.AudioHandleFactory;
import com.scholary.typesetter.playback.ClockAudioHandle;
import com.scholary.typesetter.playback.FrameScheduler;
import com.scholary.typesetter.playback.ScheduledFrameScheduler;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for measurement, karaoke and hyphenation beans.
 *
 * <p>Enables the TypesetterProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(TypesetterProperties.class)
public class TypesetterConfig {

  @Bean
  public TextWidthMeter textWidthMeter(TypesetterProperties properties) {
    TypographyProperties typography = properties.typography();
    return switch (typography.textMeter()) {
      case AWT -> new AwtTextWidthMeter(typography.fontFamily());
      case FIXED -> new FixedAdvanceTextWidthMeter(typography.fixedAdvanceEm());
    };
  }

  @Bean
  public MeasurementOracle measurementOracle(TextWidthMeter textWidthMeter) {
    return new LayoutMeasurementOracle(textWidthMeter);
  }

  @Bean
  public ImageDimensionProbe imageDimensionProbe(TypesetterProperties properties) {
    return new HttpImageDimensionProbe(
        Duration.ofMillis(properties.images().requestTimeoutMs()));
  }

  @Bean
  public ImageLoadWaiter imageLoadWaiter(
      ImageDimensionProbe probe,
      @Qualifier("taskExecutor") Executor executor,
      TypesetterProperties properties) {
    return new ImageLoadWaiter(probe, executor, properties.images().waitTimeoutMs());
  }

  @Bean
  public KaraokeSourceFactory karaokeSourceFactory(ObjectMapper objectMapper) {
    return new KaraokeSourceFactory(objectMapper);
  }

  @Bean
  public TimingFileParser timingFileParser(ObjectMapper objectMapper) {
    return new TimingFileParser(objectMapper);
  }

  @Bean
  public TimingAligner timingAligner() {
    return new TimingAligner();
  }

  @Bean
  public Hyphenator hyphenator(TypesetterProperties properties) {
    HyphenationProperties hyphenation = properties.hyphenation();
    return new Hyphenator(hyphenation, HyphenationPatterns.load(hyphenation.patterns()));
  }

  @Bean
  public FrameScheduler karaokeFrameScheduler(
      @Qualifier("frameScheduler") ScheduledExecutorService executor,
      TypesetterProperties properties) {
    return new ScheduledFrameScheduler(executor, properties.karaoke().frameIntervalMs());
  }

  /** Audio is clocked from the timing data; the track ends with the last timed word. */
  @Bean
  public AudioHandleFactory audioHandleFactory() {
    return source -> new ClockAudioHandle(System::nanoTime, trackDuration(source));
  }

  static double trackDuration(KaraokeSource source) {
    return source.wordCharRanges().stream().mapToDouble(WordCharRange::end).max().orElse(0);
  }
}
