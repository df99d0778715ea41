package com.scholary.typesetter.content;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class ElementParserTest {

  private final ElementParser parser = new ElementParser();

  @Test
  void parse_classifiesTopLevelElements() {
    List<ContentElement> elements =
        parser.parse(
            "<h2>Title</h2><p>Text</p><img src=\"a.png\"><div class=\"poetry\">Verse</div>"
                + "<p class=\"dinkus\">* * *</p><video src=\"v.mp4\"></video>");

    assertThat(elements)
        .extracting(ContentElement::kind)
        .containsExactly(
            ElementKind.HEADING,
            ElementKind.PARAGRAPH,
            ElementKind.IMAGE,
            ElementKind.POETRY,
            ElementKind.DINKUS,
            ElementKind.VIDEO);
  }

  @Test
  void parse_paragraphWithImageIsAtomic() {
    List<ContentElement> elements = parser.parse("<p>Caption <img src=\"a.png\"></p>");

    assertThat(elements).hasSize(1);
    assertThat(elements.get(0).kind()).isEqualTo(ElementKind.IMAGE);
    assertThat(elements.get(0).kind().isAtomic()).isTrue();
  }

  @Test
  void parse_detectsKaraokeAndFieldNotes() {
    List<ContentElement> elements =
        parser.parse(
            "<div class=\"karaoke-object\" data-karaoke=\"{}\"></div>"
                + "<div><span data-karaoke=\"{}\"></span></div>"
                + "<div data-field-notes-block data-image-url=\"n.jpg\"></div>");

    assertThat(elements)
        .extracting(ContentElement::kind)
        .containsExactly(
            ElementKind.KARAOKE_BLOCK, ElementKind.KARAOKE_BLOCK, ElementKind.FIELD_NOTES);
  }

  @Test
  void parse_wrapsBareTextInParagraph() {
    List<ContentElement> elements = parser.parse("  loose & text  <p>kept</p>");

    assertThat(elements).hasSize(2);
    assertThat(elements.get(0).html()).isEqualTo("<p>loose &amp; text</p>");
    assertThat(elements.get(0).textLength()).isEqualTo(12);
    assertThat(elements.get(1).html()).isEqualTo("<p>kept</p>");
  }

  @Test
  void parse_recordsTextLengthAndTag() {
    ContentElement element = parser.parse("<h5>Sub <em>title</em></h5>").get(0);

    assertThat(element.tagName()).isEqualTo("h5");
    assertThat(element.textLength()).isEqualTo(9);
    assertThat(element.isSubchapterTitle()).isTrue();
    assertThat(parser.parse("<h2>Big</h2>").get(0).isSubchapterTitle()).isFalse();
  }

  @Test
  void parse_emptyHtml() {
    assertThat(parser.parse("")).isEmpty();
    assertThat(parser.parse("   ")).isEmpty();
  }
}
