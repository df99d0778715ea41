package com.scholary.typesetter.content;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/** Helpers for parsing and serializing HTML fragments without jsoup's pretty printing. */
public final class HtmlFragments {

  private HtmlFragments() {}

  /** Parse a fragment into a body element with output settings that keep markup compact. */
  public static Element parseBody(String html) {
    Document document = Jsoup.parseBodyFragment(html == null ? "" : html);
    document.outputSettings().prettyPrint(false);
    return document.body();
  }

  /** Parse a fragment expected to hold a single top-level element. */
  public static Element parseElement(String html) {
    Element body = parseBody(html);
    if (body.childrenSize() == 1 && body.childNodeSize() == 1) {
      return body.child(0);
    }
    Element wrapper = new Element("div");
    wrapper.appendChildren(body.childNodesCopy());
    return wrapper;
  }

  /** Serialize an element without pretty printing, also for detached copies. */
  public static String outerHtml(Element element) {
    Document owner = element.ownerDocument();
    if (owner != null && !owner.outputSettings().prettyPrint()) {
      return element.outerHtml();
    }
    Document shell = Document.createShell("");
    shell.outputSettings().prettyPrint(false);
    shell.body().appendChild(element);
    return element.outerHtml();
  }

  /** Raw text of all descendant text nodes in document order, whitespace preserved. */
  public static String rawText(Node root) {
    StringBuilder text = new StringBuilder();
    root.traverse(
        (node, depth) -> {
          if (node instanceof TextNode textNode) {
            text.append(textNode.getWholeText());
          }
        });
    return text.toString();
  }

  public static String escapeText(String text) {
    return Entities.escape(text);
  }
}
