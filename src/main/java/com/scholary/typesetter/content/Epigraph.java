package com.scholary.typesetter.content;

import com.fasterxml.jackson.annotation.JsonIgnore;

/** Quotation shown on its own page before a chapter's content. */
public record Epigraph(String text, String author, String align) {

  public Epigraph {
    text = text == null ? "" : text.strip();
    author = author == null ? "" : author.strip();
    align = align == null || align.isBlank() ? "center" : align;
  }

  @JsonIgnore
  public boolean isEmpty() {
    return text.isEmpty();
  }
}
