package com.scholary.typesetter.content;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Chapter or subchapter as delivered by the chapter store.
 *
 * @param id stable chapter id
 * @param title display title
 * @param contentHtml rich-text content, may be empty
 * @param epigraph optional epigraph shown on its own page before the content
 * @param backgroundImageUrl optional page background
 * @param order position among regular chapters
 * @param cover whether this chapter is the book cover
 * @param firstPage whether this chapter is the standalone first page
 * @param children ordered subchapters
 */
public record ChapterRecord(
    String id,
    String title,
    String contentHtml,
    Epigraph epigraph,
    String backgroundImageUrl,
    Integer order,
    @JsonProperty("isCover") boolean cover,
    @JsonProperty("isFirstPage") boolean firstPage,
    List<ChapterRecord> children) {

  public ChapterRecord {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Chapter id must not be blank");
    }
    children = children == null ? List.of() : List.copyOf(children);
  }

  public boolean hasContent() {
    return contentHtml != null && !contentHtml.isBlank();
  }

  /** Special chapters always produce at least one page. */
  public boolean isSpecial() {
    return cover || firstPage;
  }
}
