package com.scholary.typesetter.footnote;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.typesetter.LayoutFixtures;
import com.scholary.typesetter.content.ChapterRecord;
import java.util.List;
import org.junit.jupiter.api.Test;

class FootnoteRegistryTest {

  @Test
  void fromHtml_numbersInFirstOccurrenceOrder() {
    FootnoteRegistry registry =
        FootnoteRegistry.fromHtml(
            List.of("<p>One^[Alpha] two^[Beta]</p>", "<p>Again^[ Alpha ] and^[Gamma]</p>"));

    assertThat(registry.size()).isEqualTo(3);
    assertThat(registry.numberFor("Alpha")).hasValue(1);
    assertThat(registry.numberFor("Beta")).hasValue(2);
    assertThat(registry.numberFor("Gamma")).hasValue(3);
  }

  @Test
  void fromHtml_readsStructuredReferences() {
    FootnoteRegistry registry =
        FootnoteRegistry.fromHtml(
            List.of(
                "<p>A<sup class=\"footnote-ref\" data-content=\"Sup note\">*</sup></p>",
                "<p>B<footnote-ref data-content=\"Element note\"></footnote-ref></p>"));

    assertThat(registry.footnotes())
        .extracting(Footnote::content)
        .containsExactly("Sup note", "Element note");
  }

  @Test
  void fromChapters_walksSubchaptersAfterChapterContent() {
    ChapterRecord child =
        new ChapterRecord(
            "c1-1", "Sub", "<p>Sub^[Second]</p>", null, null, 1, false, false, List.of());
    ChapterRecord parent =
        new ChapterRecord(
            "c1", "Main", "<p>Main^[First]</p>", null, null, 1, false, false, List.of(child));
    ChapterRecord later = LayoutFixtures.chapter("c2", 2, "<p>Later^[Third]</p>");

    FootnoteRegistry registry = FootnoteRegistry.fromChapters(List.of(parent, later));

    assertThat(registry.footnotes())
        .extracting(Footnote::content)
        .containsExactly("First", "Second", "Third");
  }

  @Test
  void numberFor_unknownContent() {
    FootnoteRegistry registry = FootnoteRegistry.fromHtml(List.of("<p>x^[Known]</p>"));

    assertThat(registry.numberFor("Unknown")).isEmpty();
    assertThat(registry.footnote(2)).isEmpty();
  }
}
