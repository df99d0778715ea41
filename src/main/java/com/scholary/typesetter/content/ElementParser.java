package com.scholary.typesetter.content;

import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

/**
 * Splits block HTML into top-level elements and classifies each one.
 *
 * <p>Elements that contain an image, video, poetry or karaoke block are atomic even when the outer
 * tag is a paragraph. Bare text at the top level is wrapped in a paragraph.
 */
@Component
public class ElementParser {

  public List<ContentElement> parse(String html) {
    List<ContentElement> elements = new ArrayList<>();
    Element body = HtmlFragments.parseBody(html);

    for (Node node : body.childNodes()) {
      if (node instanceof TextNode text) {
        String content = text.getWholeText();
        if (!content.isBlank()) {
          String wrapped = "<p>" + HtmlFragments.escapeText(content.strip()) + "</p>";
          elements.add(
              new ContentElement(ElementKind.PARAGRAPH, wrapped, "p", content.strip().length()));
        }
      } else if (node instanceof Element element) {
        elements.add(
            new ContentElement(
                classify(element),
                element.outerHtml(),
                element.normalName(),
                HtmlFragments.rawText(element).length()));
      }
    }
    return elements;
  }

  ElementKind classify(Element element) {
    String tag = element.normalName();

    if (isKaraoke(element)) {
      return ElementKind.KARAOKE_BLOCK;
    }
    if (element.hasAttr("data-field-notes-block")
        || element.selectFirst("[data-field-notes-block]") != null) {
      return ElementKind.FIELD_NOTES;
    }
    if (tag.matches("h[1-6]")) {
      return ElementKind.HEADING;
    }
    if ("img".equals(tag)) {
      return ElementKind.IMAGE;
    }
    if ("video".equals(tag)) {
      return ElementKind.VIDEO;
    }
    if (element.hasClass("poetry")) {
      return ElementKind.POETRY;
    }
    if (element.hasClass("dinkus") || element.hasClass("dinkus-image")) {
      return ElementKind.DINKUS;
    }
    if (element.selectFirst("img") != null) {
      return ElementKind.IMAGE;
    }
    if (element.selectFirst("video") != null) {
      return ElementKind.VIDEO;
    }
    if (element.selectFirst(".poetry") != null) {
      return ElementKind.POETRY;
    }
    if (element.selectFirst(".dinkus") != null) {
      return ElementKind.DINKUS;
    }
    return ElementKind.PARAGRAPH;
  }

  private static boolean isKaraoke(Element element) {
    return element.hasClass("karaoke-object")
        || element.hasAttr("data-karaoke")
        || element.selectFirst(".karaoke-object, [data-karaoke]") != null;
  }
}
