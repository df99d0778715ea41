package com.scholary.typesetter.karaoke;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.typesetter.content.HtmlFragments;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds karaoke sources from block markup.
 *
 * <p>The payload lives in the {@code data-karaoke} attribute as URL-encoded JSON; raw JSON is
 * accepted as well. Timed words are matched greedily, in order, against the tokens of the
 * normalized text, and each matched word's duration is divided evenly over its letters.
 */
public class KaraokeSourceFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(KaraokeSourceFactory.class);

  public static final String PAYLOAD_ATTRIBUTE = "data-karaoke";
  public static final String ID_ATTRIBUTE = "data-karaoke-id";

  private static final double MIN_WORD_DURATION = 0.001;

  private final ObjectMapper objectMapper;

  public KaraokeSourceFactory(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Read the karaoke block carried by the element or one of its descendants.
   *
   * @param elementHtml outer HTML of the content element
   * @param fallbackId id used when the markup declares none
   * @return the source, or empty when no readable payload with text is present
   */
  public Optional<KaraokeSource> fromElement(String elementHtml, String fallbackId) {
    Element element = HtmlFragments.parseElement(elementHtml);
    Element carrier =
        element.hasAttr(PAYLOAD_ATTRIBUTE)
            ? element
            : element.selectFirst("[" + PAYLOAD_ATTRIBUTE + "]");
    if (carrier == null) {
      return Optional.empty();
    }

    Optional<KaraokePayload> payload = readPayload(carrier.attr(PAYLOAD_ATTRIBUTE));
    if (payload.isEmpty()) {
      return Optional.empty();
    }

    String rawText = payload.get().text();
    if (rawText == null || rawText.isBlank()) {
      rawText = HtmlFragments.rawText(carrier);
    }
    String text = WordNormalizer.normalizeText(rawText);
    if (text.isBlank()) {
      return Optional.empty();
    }

    String declaredId = carrier.attr(ID_ATTRIBUTE);
    String id = declaredId.isBlank() ? fallbackId : declaredId;
    return Optional.of(create(id, text, payload.get().audioUrl(), payload.get().wordTimings()));
  }

  /** Build a source for already normalized text. */
  public KaraokeSource create(
      String id, String text, String audioUrl, List<WordTiming> wordTimings) {
    List<LetterTiming> letterTimings = new ArrayList<>(Collections.nCopies(text.length(), null));
    List<WordCharRange> wordCharRanges = new ArrayList<>();
    List<WordNormalizer.Token> tokens = WordNormalizer.tokenize(text);
    int tokenPointer = 0;

    for (int wordIndex = 0; wordIndex < wordTimings.size(); wordIndex++) {
      WordTiming timing = wordTimings.get(wordIndex);
      String normalized = WordNormalizer.normalizeWord(timing.word());
      if (normalized.isEmpty()) {
        continue;
      }

      WordNormalizer.Token matched = null;
      while (tokenPointer < tokens.size()) {
        WordNormalizer.Token candidate = tokens.get(tokenPointer);
        if (!candidate.normalized().isEmpty() && candidate.normalized().equals(normalized)) {
          matched = candidate;
          break;
        }
        tokenPointer++;
      }
      if (matched == null) {
        // tokens exhausted, the word stays untimed
        continue;
      }

      double duration = Math.max(timing.end() - timing.start(), MIN_WORD_DURATION);
      int span = matched.end() - matched.start();
      for (int position = 0; position < span; position++) {
        letterTimings.set(
            matched.start() + position,
            new LetterTiming(
                timing.start() + duration * position / span,
                timing.start() + duration * (position + 1) / span));
      }
      wordCharRanges.add(
          new WordCharRange(
              timing.word(),
              timing.start(),
              timing.end(),
              matched.start(),
              matched.end(),
              wordIndex));
      tokenPointer++;
    }

    LOGGER.debug(
        "Karaoke source built: id={}, chars={}, words={}, matched={}",
        id,
        text.length(),
        wordTimings.size(),
        wordCharRanges.size());
    return new KaraokeSource(id, text, audioUrl, letterTimings, wordCharRanges);
  }

  private Optional<KaraokePayload> readPayload(String attribute) {
    if (attribute == null || attribute.isBlank()) {
      return Optional.empty();
    }
    String json = decodeUriComponent(attribute);
    try {
      return Optional.ofNullable(objectMapper.readValue(json, KaraokePayload.class));
    } catch (JsonProcessingException | IllegalArgumentException e) {
      LOGGER.warn("Unreadable karaoke payload, block will be laid out as-is: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /** Percent-decoding that, unlike form decoding, leaves {@code +} alone. */
  static String decodeUriComponent(String value) {
    try {
      return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      return value;
    }
  }
}
