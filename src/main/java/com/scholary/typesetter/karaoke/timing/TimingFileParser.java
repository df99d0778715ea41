package com.scholary.typesetter.karaoke.timing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.typesetter.karaoke.WordTiming;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads word timings from a timing file.
 *
 * <p>Parsing is all or nothing: any malformed entry fails the whole file with {@link
 * UnsupportedTimingFormatException} and no timings are returned.
 */
public class TimingFileParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimingFileParser.class);

  private static final Pattern LABEL_LINE =
      Pattern.compile("^\\s*(\\d+(?:\\.\\d+)?)\\t(\\d+(?:\\.\\d+)?)\\t(.*)$");

  private final ObjectMapper objectMapper;

  public TimingFileParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parse a timing file.
   *
   * @param content file content
   * @param format declared format, or null to detect it
   * @return timings in file order
   * @throws UnsupportedTimingFormatException when the content cannot be read as the format
   */
  public List<WordTiming> parse(String content, TimingFormat format) {
    if (content == null || content.isBlank()) {
      throw new UnsupportedTimingFormatException("Timing file is empty");
    }
    TimingFormat resolved = format != null ? format : detect(content);
    List<WordTiming> timings =
        switch (resolved) {
          case JSON_WORDS -> wordsArray(readJson(content), "$");
          case KARAOKE_PAYLOAD -> wordsArray(readJson(content).path("wordTimings"), "wordTimings");
          case DEEPGRAM -> wordsArray(deepgramWords(readJson(content)), "results.words");
          case LABELS -> labels(content);
        };
    LOGGER.debug("Parsed timing file: format={}, words={}", resolved, timings.size());
    return timings;
  }

  /** Detect the format from the shape of the content. */
  public TimingFormat detect(String content) {
    String trimmed = content.strip();
    if (trimmed.startsWith("[")) {
      return TimingFormat.JSON_WORDS;
    }
    if (trimmed.startsWith("{")) {
      JsonNode root = readJson(trimmed);
      if (root.has("wordTimings")) {
        return TimingFormat.KARAOKE_PAYLOAD;
      }
      if (root.has("results")) {
        return TimingFormat.DEEPGRAM;
      }
      throw new UnsupportedTimingFormatException(
          "JSON timing file has neither wordTimings nor results");
    }
    String firstLine = trimmed.lines().findFirst().orElse("");
    if (LABEL_LINE.matcher(firstLine).matches()) {
      return TimingFormat.LABELS;
    }
    throw new UnsupportedTimingFormatException("Unrecognized timing file format");
  }

  private JsonNode readJson(String content) {
    try {
      return objectMapper.readTree(content);
    } catch (JsonProcessingException e) {
      throw new UnsupportedTimingFormatException("Timing file is not valid JSON", e);
    }
  }

  private static JsonNode deepgramWords(JsonNode root) {
    return root.path("results").path("channels").path(0).path("alternatives").path(0).path("words");
  }

  private static List<WordTiming> wordsArray(JsonNode array, String path) {
    if (!array.isArray()) {
      throw new UnsupportedTimingFormatException("Expected an array of words at " + path);
    }
    List<WordTiming> timings = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      JsonNode entry = array.get(i);
      JsonNode word = entry.get("word");
      JsonNode start = entry.get("start");
      JsonNode end = entry.get("end");
      if (word == null || !word.isTextual() || start == null || !start.isNumber()) {
        throw new UnsupportedTimingFormatException(
            String.format("Malformed word entry at %s[%d]", path, i));
      }
      double startSeconds = start.asDouble();
      double endSeconds = end != null && end.isNumber() ? end.asDouble() : startSeconds;
      timings.add(checked(word.asText(), startSeconds, endSeconds, path + "[" + i + "]"));
    }
    return timings;
  }

  private static List<WordTiming> labels(String content) {
    List<WordTiming> timings = new ArrayList<>();
    int lineNumber = 0;
    for (String line : content.lines().toList()) {
      lineNumber++;
      if (line.isBlank()) {
        continue;
      }
      Matcher matcher = LABEL_LINE.matcher(line);
      if (!matcher.matches()) {
        throw new UnsupportedTimingFormatException("Malformed label line " + lineNumber);
      }
      timings.add(
          checked(
              matcher.group(3).strip(),
              Double.parseDouble(matcher.group(1)),
              Double.parseDouble(matcher.group(2)),
              "line " + lineNumber));
    }
    return timings;
  }

  private static WordTiming checked(String word, double start, double end, String location) {
    if (start < 0 || end < start) {
      throw new UnsupportedTimingFormatException(
          String.format("Invalid time range at %s: start=%.3f, end=%.3f", location, start, end));
    }
    return new WordTiming(word, start, end);
  }
}
