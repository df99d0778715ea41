package com.scholary.typesetter.footnote;

import com.scholary.typesetter.content.HtmlFragments;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.regex.Matcher;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

/** Renders footnote references and the footnote section of a page. */
public class FootnoteRenderer {

  private final FootnoteRegistry registry;

  public FootnoteRenderer(FootnoteRegistry registry) {
    this.registry = registry;
  }

  /**
   * Replace footnote references with numbered superscripts.
   *
   * <p>Unknown content renders as {@code ?} and is not listed.
   *
   * @return the rewritten HTML and the footnotes it references, sorted by number
   */
  public NumberedContent numberReferences(String html) {
    TreeMap<Integer, Footnote> referenced = new TreeMap<>();

    Matcher matcher = FootnoteMarkers.INLINE_MARKER.matcher(html);
    StringBuilder rewritten = new StringBuilder();
    while (matcher.find()) {
      matcher.appendReplacement(
          rewritten,
          Matcher.quoteReplacement(
              superscript(Parser.unescapeEntities(matcher.group(1), false), referenced)));
    }
    matcher.appendTail(rewritten);

    String result = rewritten.toString();
    if (result.contains(FootnoteMarkers.CONTENT_ATTRIBUTE)) {
      Element body = HtmlFragments.parseBody(result);
      boolean changed = false;
      for (Element reference : body.select("[" + FootnoteMarkers.CONTENT_ATTRIBUTE + "]")) {
        if (FootnoteMarkers.isStructuredReference(reference)) {
          reference.replaceWith(
              HtmlFragments.parseElement(
                  superscript(reference.attr(FootnoteMarkers.CONTENT_ATTRIBUTE), referenced)));
          changed = true;
        }
      }
      if (changed) {
        result = body.html();
      }
    }
    return new NumberedContent(result, new ArrayList<>(referenced.values()));
  }

  private String superscript(String content, TreeMap<Integer, Footnote> referenced) {
    OptionalInt number = registry.numberFor(content);
    if (number.isEmpty()) {
      return "<sup class=\"footnote-ref\">?</sup>";
    }
    registry.footnote(number.getAsInt()).ifPresent(fn -> referenced.put(fn.number(), fn));
    return String.format(
        "<sup class=\"footnote-ref\" %s=\"%d\">%d</sup>",
        FootnoteMarkers.NUMBER_ATTRIBUTE, number.getAsInt(), number.getAsInt());
  }

  /** Render the footnote section drawn at the bottom of a page. */
  public String renderSection(List<Footnote> footnotes) {
    StringBuilder html = new StringBuilder();
    html.append("<div class=\"footnotes-section\"><div class=\"footnotes-divider\"></div>")
        .append("<div class=\"footnotes-list\">");
    for (Footnote footnote : footnotes) {
      html.append("<div class=\"footnote-item\" ")
          .append(FootnoteMarkers.NUMBER_ATTRIBUTE)
          .append("=\"")
          .append(footnote.number())
          .append("\"><span class=\"footnote-number\">")
          .append(footnote.number())
          .append(".</span><span class=\"footnote-content\">")
          .append(HtmlFragments.escapeText(footnote.content()))
          .append("</span></div>");
    }
    html.append("</div></div>");
    return html.toString();
  }

  /** Page HTML with numbered references, plus the footnotes it references. */
  public record NumberedContent(String html, List<Footnote> footnotes) {

    public NumberedContent {
      footnotes = List.copyOf(footnotes);
    }
  }
}
