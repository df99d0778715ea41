package com.scholary.typesetter.content;

/**
 * One top-level element of a content block.
 *
 * @param kind classification
 * @param html outer HTML of the element
 * @param tagName lower-case tag name
 * @param textLength length of the element's text content
 */
public record ContentElement(ElementKind kind, String html, String tagName, int textLength) {

  /** Subchapter titles (h4-h6) mark the page as carrying a heading before they are measured. */
  public boolean isSubchapterTitle() {
    return kind == ElementKind.HEADING
        && ("h4".equals(tagName) || "h5".equals(tagName) || "h6".equals(tagName));
  }

  public boolean isHeading() {
    return kind == ElementKind.HEADING;
  }
}
