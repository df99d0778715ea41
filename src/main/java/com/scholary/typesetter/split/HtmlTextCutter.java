package com.scholary.typesetter.split;

import com.scholary.typesetter.content.HtmlFragments;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Cuts an element at a character offset of its text while keeping inline markup on both sides.
 *
 * <p>Offsets count the raw text of descendant text nodes in document order. Both halves are deep
 * copies wrapped in the original element's tag and attributes.
 */
final class HtmlTextCutter {

  private HtmlTextCutter() {}

  /** The element holding the first {@code length} characters, trailing whitespace removed. */
  static String prefix(Element element, int length) {
    Element copy = element.clone();
    retainPrefix(copy, new int[] {length});
    trimTrailingWhitespace(copy);
    return HtmlFragments.outerHtml(copy);
  }

  /** The element holding the text from {@code start} on, leading whitespace removed. */
  static String suffix(Element element, int start) {
    Element copy = element.clone();
    dropPrefix(copy, new int[] {start});
    trimLeadingWhitespace(copy);
    return HtmlFragments.outerHtml(copy);
  }

  private static void retainPrefix(Element element, int[] budget) {
    for (Node child : new ArrayList<>(element.childNodes())) {
      if (budget[0] <= 0) {
        child.remove();
        continue;
      }
      if (child instanceof TextNode text) {
        String value = text.getWholeText();
        if (value.length() <= budget[0]) {
          budget[0] -= value.length();
        } else {
          text.text(value.substring(0, budget[0]));
          budget[0] = 0;
        }
      } else if (child instanceof Element nested) {
        retainPrefix(nested, budget);
      }
    }
  }

  private static void dropPrefix(Element element, int[] skip) {
    for (Node child : new ArrayList<>(element.childNodes())) {
      if (skip[0] <= 0) {
        return;
      }
      if (child instanceof TextNode text) {
        String value = text.getWholeText();
        if (value.length() <= skip[0]) {
          skip[0] -= value.length();
          text.remove();
        } else {
          text.text(value.substring(skip[0]));
          skip[0] = 0;
        }
      } else if (child instanceof Element nested) {
        int nestedLength = textLength(nested);
        if (nestedLength <= skip[0]) {
          skip[0] -= nestedLength;
          nested.remove();
        } else {
          dropPrefix(nested, skip);
        }
      } else {
        child.remove();
      }
    }
  }

  private static void trimLeadingWhitespace(Element element) {
    for (TextNode text : textNodes(element)) {
      String stripped = text.getWholeText().stripLeading();
      if (stripped.isEmpty()) {
        text.remove();
        continue;
      }
      text.text(stripped);
      return;
    }
  }

  private static void trimTrailingWhitespace(Element element) {
    List<TextNode> texts = textNodes(element);
    for (int i = texts.size() - 1; i >= 0; i--) {
      TextNode text = texts.get(i);
      String stripped = text.getWholeText().stripTrailing();
      if (stripped.isEmpty()) {
        text.remove();
        continue;
      }
      text.text(stripped);
      return;
    }
  }

  private static List<TextNode> textNodes(Element element) {
    List<TextNode> texts = new ArrayList<>();
    element.traverse(
        (node, depth) -> {
          if (node instanceof TextNode text) {
            texts.add(text);
          }
        });
    return texts;
  }

  static int textLength(Element element) {
    int[] length = {0};
    element.traverse(
        (node, depth) -> {
          if (node instanceof TextNode text) {
            length[0] += text.getWholeText().length();
          }
        });
    return length[0];
  }
}
