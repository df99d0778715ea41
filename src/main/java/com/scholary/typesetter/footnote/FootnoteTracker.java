package com.scholary.typesetter.footnote;

import com.scholary.typesetter.measure.MeasurementOracle;
import com.scholary.typesetter.measure.StyleContext;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Maps footnote references to global numbers and measures footnote sections.
 *
 * <p>One tracker serves one pagination run. Section heights are memoized per set of numbers, since
 * the paginator asks for the same set repeatedly while filling a page.
 */
public class FootnoteTracker {

  private final FootnoteRegistry registry;
  private final FootnoteRenderer renderer;
  private final MeasurementOracle oracle;
  private final StyleContext style;
  private final double sectionWidth;
  private final double extraPadding;
  private final Map<List<Integer>, Double> sectionHeights = new HashMap<>();

  public FootnoteTracker(
      FootnoteRegistry registry,
      MeasurementOracle oracle,
      StyleContext style,
      double sectionWidth,
      double extraPadding) {
    this.registry = registry;
    this.renderer = new FootnoteRenderer(registry);
    this.oracle = oracle;
    this.style = style;
    this.sectionWidth = sectionWidth;
    this.extraPadding = extraPadding;
  }

  /** Global numbers of the footnotes referenced by a fragment. Unknown content is ignored. */
  public SortedSet<Integer> extractFootnoteRefs(String html) {
    SortedSet<Integer> numbers = new TreeSet<>();
    for (String content : FootnoteMarkers.contentsInOrder(html)) {
      OptionalInt number = registry.numberFor(content);
      if (number.isPresent()) {
        numbers.add(number.getAsInt());
      }
    }
    return numbers;
  }

  /**
   * Height of the footnote section listing the given footnotes.
   *
   * <p>The bottom padding of the section is visual spacing and is not reserved from the content
   * area. Returns 0 when there is nothing to list.
   */
  public double measureFootnoteSectionHeight(Collection<Integer> numbers) {
    if (numbers.isEmpty()) {
      return 0;
    }
    List<Integer> key = new ArrayList<>(new TreeSet<>(numbers));
    return sectionHeights.computeIfAbsent(key, this::measure);
  }

  private double measure(List<Integer> sortedNumbers) {
    List<Footnote> footnotes = resolve(sortedNumbers);
    if (footnotes.isEmpty()) {
      return 0;
    }
    double height = oracle.measureHeight(renderer.renderSection(footnotes), sectionWidth, style);
    return Math.max(0, height - extraPadding);
  }

  public List<Footnote> resolve(Collection<Integer> numbers) {
    List<Footnote> footnotes = new ArrayList<>();
    for (Integer number : new TreeSet<>(numbers)) {
      registry.footnote(number).ifPresent(footnotes::add);
    }
    return footnotes;
  }

  public FootnoteRenderer renderer() {
    return renderer;
  }
}
