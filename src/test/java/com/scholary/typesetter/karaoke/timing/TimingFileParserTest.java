package com.scholary.typesetter.karaoke.timing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.typesetter.karaoke.WordTiming;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TimingFileParserTest {

  private TimingFileParser parser;

  @BeforeEach
  void setUp() {
    parser = new TimingFileParser(new ObjectMapper());
  }

  @Test
  void parse_jsonWordsArray() {
    List<WordTiming> timings =
        parser.parse(
            "[{\"word\":\"hello\",\"start\":0.0,\"end\":0.4},"
                + "{\"word\":\"world\",\"start\":0.5,\"end\":1}]",
            null);

    assertThat(timings)
        .containsExactly(new WordTiming("hello", 0.0, 0.4), new WordTiming("world", 0.5, 1.0));
  }

  @Test
  void parse_karaokePayload() {
    List<WordTiming> timings =
        parser.parse(
            "{\"text\":\"hi\",\"wordTimings\":[{\"word\":\"hi\",\"start\":1,\"end\":2}]}", null);

    assertThat(timings).containsExactly(new WordTiming("hi", 1, 2));
  }

  @Test
  void parse_speechToTextResponse() {
    String content =
        "{\"results\":{\"channels\":[{\"alternatives\":[{\"words\":["
            + "{\"word\":\"one\",\"start\":0.1,\"end\":0.3},"
            + "{\"word\":\"two\",\"start\":0.3,\"end\":0.6}]}]}]}}";

    assertThat(parser.parse(content, null))
        .extracting(WordTiming::word)
        .containsExactly("one", "two");
  }

  @Test
  void parse_labelLines() {
    String content = "0.000000\t0.500000\tOnce\n0.500000\t1.250000\tupon\n\n1.25\t2\ta time\n";

    List<WordTiming> timings = parser.parse(content, null);

    assertThat(timings)
        .containsExactly(
            new WordTiming("Once", 0, 0.5),
            new WordTiming("upon", 0.5, 1.25),
            new WordTiming("a time", 1.25, 2));
  }

  @Test
  void parse_missingEndDefaultsToStart() {
    List<WordTiming> timings =
        parser.parse("[{\"word\":\"x\",\"start\":3}]", TimingFormat.JSON_WORDS);

    assertThat(timings).containsExactly(new WordTiming("x", 3, 3));
  }

  @Test
  void parse_rejectsEmptyContent() {
    assertThatThrownBy(() -> parser.parse("  ", null))
        .isInstanceOf(UnsupportedTimingFormatException.class)
        .hasMessageContaining("empty");
  }

  @Test
  void parse_rejectsUnknownShape() {
    assertThatThrownBy(() -> parser.parse("WEBVTT\n\n00:00.000 --> 00:01.000\nhi", null))
        .isInstanceOf(UnsupportedTimingFormatException.class);
    assertThatThrownBy(() -> parser.parse("{\"words\":[]}", null))
        .isInstanceOf(UnsupportedTimingFormatException.class);
  }

  @Test
  void parse_rejectsWholeFileOnMalformedEntry() {
    String content = "[{\"word\":\"ok\",\"start\":0,\"end\":1},{\"word\":\"bad\"}]";

    assertThatThrownBy(() -> parser.parse(content, null))
        .isInstanceOf(UnsupportedTimingFormatException.class)
        .hasMessageContaining("$[1]");
  }

  @Test
  void parse_rejectsReversedTimeRange() {
    assertThatThrownBy(() -> parser.parse("2.0\t1.0\tbackwards", null))
        .isInstanceOf(UnsupportedTimingFormatException.class)
        .hasMessageContaining("line 1");
  }

  @Test
  void parse_rejectsMalformedLabelLine() {
    assertThatThrownBy(() -> parser.parse("0\t1\tfine\nnot a label", TimingFormat.LABELS))
        .isInstanceOf(UnsupportedTimingFormatException.class)
        .hasMessageContaining("line 2");
  }

  @Test
  void parse_rejectsInvalidJson() {
    assertThatThrownBy(() -> parser.parse("[{\"word\":", null))
        .isInstanceOf(UnsupportedTimingFormatException.class)
        .hasMessageContaining("not valid JSON");
  }

  @Test
  void detect_recognizesEachFormat() {
    assertThat(parser.detect("[]")).isEqualTo(TimingFormat.JSON_WORDS);
    assertThat(parser.detect("{\"wordTimings\":[]}")).isEqualTo(TimingFormat.KARAOKE_PAYLOAD);
    assertThat(parser.detect("{\"results\":{}}")).isEqualTo(TimingFormat.DEEPGRAM);
    assertThat(parser.detect("0.1\t0.2\tword")).isEqualTo(TimingFormat.LABELS);
  }
}
