package com.scholary.typesetter.footnote;

import com.scholary.typesetter.content.HtmlFragments;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

/**
 * Recognizes the two footnote notations.
 *
 * <ul>
 *   <li>Inline markers in text: {@code ^[footnote text]}
 *   <li>Structured reference nodes: {@code <sup class="footnote-ref" data-content="...">} or a
 *       {@code <footnote-ref data-content="...">} element
 * </ul>
 */
public final class FootnoteMarkers {

  public static final Pattern INLINE_MARKER = Pattern.compile("\\^\\[([^\\]]+)\\]");
  public static final String CONTENT_ATTRIBUTE = "data-content";
  public static final String NUMBER_ATTRIBUTE = "data-footnote-number";

  private FootnoteMarkers() {}

  /** Footnote contents referenced by the fragment, trimmed, in document order with repeats. */
  public static List<String> contentsInOrder(String html) {
    List<String> contents = new ArrayList<>();
    if (html == null || html.isEmpty()) {
      return contents;
    }
    HtmlFragments.parseBody(html)
        .traverse(
            (node, depth) -> {
              if (node instanceof TextNode text) {
                Matcher matcher = INLINE_MARKER.matcher(text.getWholeText());
                while (matcher.find()) {
                  addIfPresent(contents, matcher.group(1));
                }
              } else if (node instanceof Element element && isStructuredReference(element)) {
                addIfPresent(contents, element.attr(CONTENT_ATTRIBUTE));
              }
            });
    return contents;
  }

  /** Whether the element is a structured footnote reference carrying its content. */
  public static boolean isStructuredReference(Element element) {
    return element.hasAttr(CONTENT_ATTRIBUTE)
        && (element.hasClass("footnote-ref") || "footnote-ref".equals(element.normalName()));
  }

  private static void addIfPresent(List<String> contents, String content) {
    String trimmed = content.trim();
    if (!trimmed.isEmpty()) {
      contents.add(trimmed);
    }
  }
}
