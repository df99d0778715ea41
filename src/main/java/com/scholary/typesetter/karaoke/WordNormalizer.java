package com.scholary.typesetter.karaoke;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Tokenizes karaoke text and normalizes words so timing data can be matched to it. */
public final class WordNormalizer {

  private static final Pattern TOKEN =
      Pattern.compile(
          "[a-zA-Z0-9\\u00C0-\\u017F\\u0400-\\u04FF"
              + "\\u3040-\\u309F\\u30A0-\\u30FF\\u4E00-\\u9FFF'\\u2019]+");
  private static final Pattern COMBINING_MARKS = Pattern.compile("[\\u0300-\\u036f]");
  private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9']+");

  private WordNormalizer() {}

  /**
   * Replace typographic apostrophes with a plain one, drop soft hyphens and unify line endings.
   * Character offsets into the result stay valid after an HTML round trip.
   */
  public static String normalizeText(String text) {
    return text.replace("\r\n", "\n")
        .replace('\r', '\n')
        .replace('\u2019', '\'')
        .replace('\u2018', '\'')
        .replace('\u02BC', '\'')
        .replace("\u00AD", "");
  }

  /** Compare form of a word: decomposed, diacritics stripped, lower case, letters and digits. */
  public static String normalizeWord(String value) {
    if (value == null || value.isEmpty()) {
      return "";
    }
    String decomposed = Normalizer.normalize(value, Normalizer.Form.NFKD).replace('\u2019', '\'');
    String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
    return NON_WORD.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll("");
  }

  public static List<Token> tokenize(String text) {
    List<Token> tokens = new ArrayList<>();
    Matcher matcher = TOKEN.matcher(text);
    while (matcher.find()) {
      tokens.add(
          new Token(
              matcher.group(), matcher.start(), matcher.end(), normalizeWord(matcher.group())));
    }
    return tokens;
  }

  /** A word-like token of the source text. */
  public record Token(String raw, int start, int end, String normalized) {}
}
