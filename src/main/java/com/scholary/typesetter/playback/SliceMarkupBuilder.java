package com.scholary.typesetter.playback;

import com.scholary.typesetter.content.HtmlFragments;
import com.scholary.typesetter.karaoke.KaraokeSlice;
import com.scholary.typesetter.karaoke.KaraokeSource;
import com.scholary.typesetter.karaoke.KaraokeSlicer;
import com.scholary.typesetter.karaoke.WordCharRange;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

/** Builds the per-word highlight markup of a slice. */
public final class SliceMarkupBuilder {

  public static final String WORD_CLASS = "karaoke-word";
  public static final String LETTER_CLASS = "karaoke-letter";

  private SliceMarkupBuilder() {}

  /** Timed words of the slice, clipped to its character range. */
  public static List<SliceWord> words(KaraokeSource source, KaraokeSlice slice) {
    List<SliceWord> words = new ArrayList<>();
    for (WordCharRange range : source.wordsIn(slice.startChar(), slice.endChar())) {
      words.add(
          new SliceWord(
              range.wordIndex(),
              Math.max(range.charStart(), slice.startChar()),
              Math.min(range.charEnd(), slice.endChar()),
              range.start(),
              range.end()));
    }
    return words;
  }

  /**
   * Slice text with each timed word wrapped in a span carrying its index and timing, and each of
   * its letters in a span carrying the character index. Text between words stays plain and
   * newlines become line breaks.
   */
  public static String markup(KaraokeSource source, KaraokeSlice slice, List<SliceWord> words) {
    Element span =
        new Element("span")
            .addClass(KaraokeSlicer.SLICE_CLASS)
            .attr("data-karaoke-id", slice.karaokeId())
            .attr("data-karaoke-start", String.valueOf(slice.startChar()))
            .attr("data-karaoke-end", String.valueOf(slice.endChar()));
    String text = source.text();
    int cursor = slice.startChar();
    for (SliceWord word : words) {
      appendText(span, text.substring(cursor, word.charStart()));
      Element wordSpan =
          span.appendElement("span")
              .addClass(WORD_CLASS)
              .attr("data-word-index", String.valueOf(word.wordIndex()))
              .attr("data-start", String.valueOf(word.start()))
              .attr("data-end", String.valueOf(word.end()));
      for (int i = word.charStart(); i < word.charEnd(); i++) {
        wordSpan
            .appendElement("span")
            .addClass(LETTER_CLASS)
            .attr("data-char-index", String.valueOf(i))
            .appendChild(new TextNode(String.valueOf(text.charAt(i))));
      }
      cursor = word.charEnd();
    }
    appendText(span, text.substring(cursor, slice.endChar()));
    return HtmlFragments.outerHtml(span);
  }

  private static void appendText(Element parent, String text) {
    String[] lines = text.split("\n", -1);
    for (int i = 0; i < lines.length; i++) {
      if (i > 0) {
        parent.appendElement("br");
      }
      if (!lines[i].isEmpty()) {
        parent.appendChild(new TextNode(lines[i]));
      }
    }
  }
}
