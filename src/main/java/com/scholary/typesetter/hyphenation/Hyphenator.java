package com.scholary.typesetter.hyphenation;

import com.scholary.typesetter.config.TypesetterProperties.HyphenationProperties;
import com.scholary.typesetter.content.HtmlFragments;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.fop.hyphenation.Hyphenation;
import org.apache.fop.hyphenation.HyphenationTree;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Inserts soft hyphens at the break points of a Liang pattern tree.
 *
 * <p>Words shorter than the configured minimum are left alone, as are break points that would
 * leave fewer letters than the prefix or suffix minimum on either side. Text inside karaoke
 * blocks and footnote references is never hyphenated.
 */
public class Hyphenator {

  public static final char SOFT_HYPHEN = '\u00AD';

  private static final Pattern WORD = Pattern.compile("\\p{L}+");
  private static final String PROTECTED_SELECTOR =
      ".karaoke-block, .karaoke-slice, [data-karaoke], sup.footnote-ref";

  private final HyphenationProperties properties;
  private final HyphenationTree patterns;

  public Hyphenator(HyphenationProperties properties, HyphenationTree patterns) {
    this.properties = properties;
    this.patterns = patterns;
  }

  public boolean isEnabled() {
    return properties.enabled();
  }

  public String hyphenateWord(String word) {
    if (word.length() < properties.minWordLength()) {
      return word;
    }
    Hyphenation hyphenation = patterns.hyphenate(word, 1, 1);
    if (hyphenation == null) {
      return word;
    }
    StringBuilder result = new StringBuilder(word.length() + 4);
    int lastBreak = 0;
    for (int point : hyphenation.getHyphenationPoints()) {
      if (point > lastBreak
          && point >= properties.minPrefix()
          && word.length() - point >= properties.minSuffix()) {
        result.append(word, lastBreak, point).append(SOFT_HYPHEN);
        lastBreak = point;
      }
    }
    return result.append(word, lastBreak, word.length()).toString();
  }

  /** Hyphenate every word in the text content of an HTML fragment, markup untouched. */
  public String hyphenateHtml(String html) {
    Element body = HtmlFragments.parseBody(html);
    body.traverse(
        (node, depth) -> {
          if (node instanceof TextNode text && !isProtected(text)) {
            text.text(hyphenateText(text.getWholeText()));
          }
        });
    return body.html();
  }

  String hyphenateText(String text) {
    Matcher matcher = WORD.matcher(text);
    StringBuilder result = new StringBuilder(text.length() + 16);
    while (matcher.find()) {
      matcher.appendReplacement(result, Matcher.quoteReplacement(hyphenateWord(matcher.group())));
    }
    matcher.appendTail(result);
    return result.toString();
  }

  private static boolean isProtected(Node node) {
    for (Node parent = node.parent(); parent != null; parent = parent.parent()) {
      if (parent instanceof Element element && element.is(PROTECTED_SELECTOR)) {
        return true;
      }
    }
    return false;
  }
}
