package com.scholary.typesetter.footnote;

import com.scholary.typesetter.content.ChapterRecord;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Book-wide footnote numbering.
 *
 * <p>Built once from every chapter before pagination starts. The first occurrence of a footnote's
 * content takes the next number; later occurrences of the same content reuse it. Numbers never
 * depend on the order in which pages are finalized.
 */
public final class FootnoteRegistry {

  private final Map<String, Integer> contentToNumber;
  private final List<Footnote> footnotes;

  private FootnoteRegistry(Map<String, Integer> contentToNumber, List<Footnote> footnotes) {
    this.contentToNumber = Collections.unmodifiableMap(contentToNumber);
    this.footnotes = List.copyOf(footnotes);
  }

  /** Number footnotes across chapters in reading order: chapter content, then its subchapters. */
  public static FootnoteRegistry fromChapters(List<ChapterRecord> chapters) {
    List<String> htmlInOrder = new ArrayList<>();
    for (ChapterRecord chapter : chapters) {
      collect(chapter, htmlInOrder);
    }
    return fromHtml(htmlInOrder);
  }

  public static FootnoteRegistry fromHtml(List<String> htmlInOrder) {
    Map<String, Integer> contentToNumber = new LinkedHashMap<>();
    List<Footnote> footnotes = new ArrayList<>();
    for (String html : htmlInOrder) {
      for (String content : FootnoteMarkers.contentsInOrder(html)) {
        if (!contentToNumber.containsKey(content)) {
          int number = footnotes.size() + 1;
          contentToNumber.put(content, number);
          footnotes.add(new Footnote(number, content));
        }
      }
    }
    return new FootnoteRegistry(contentToNumber, footnotes);
  }

  private static void collect(ChapterRecord chapter, List<String> htmlInOrder) {
    if (chapter.hasContent()) {
      htmlInOrder.add(chapter.contentHtml());
    }
    for (ChapterRecord child : chapter.children()) {
      collect(child, htmlInOrder);
    }
  }

  public OptionalInt numberFor(String content) {
    Integer number = contentToNumber.get(content.trim());
    return number == null ? OptionalInt.empty() : OptionalInt.of(number);
  }

  public Optional<Footnote> footnote(int number) {
    if (number < 1 || number > footnotes.size()) {
      return Optional.empty();
    }
    return Optional.of(footnotes.get(number - 1));
  }

  public List<Footnote> footnotes() {
    return footnotes;
  }

  public int size() {
    return footnotes.size();
  }
}
