package com.scholary.typesetter.karaoke;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.typesetter.LayoutFixtures;
import com.scholary.typesetter.split.TextSplitter;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KaraokeSlicerTest {

  private KaraokeSlicer slicer;
  private KaraokeSourceFactory factory;

  @BeforeEach
  void setUp() {
    TextSplitter splitter = new TextSplitter(LayoutFixtures.oracle(), 2);
    slicer = new KaraokeSlicer(splitter, 200, LayoutFixtures.style(), 80);
    factory = new KaraokeSourceFactory(new ObjectMapper());
  }

  @Test
  void slice_fitsWholeWordsPerPage() {
    // 30 words of 5 characters with spaces, 4 words per line, 5 lines per page
    KaraokeSource source = source(LayoutFixtures.words(30, "abcd"));
    RecordingTarget target = new RecordingTarget(100);

    slicer.slice(source, target);

    assertThat(target.allSlices())
        .containsExactly(new KaraokeSlice("k", 0, 99), new KaraokeSlice("k", 99, 149));
    assertThat(target.finishedPages).hasSize(1);
    assertThat(target.current).hasSize(1);
  }

  @Test
  void slice_forcesChunkWhenNothingFitsAnEmptyPage() {
    KaraokeSource source = source(LayoutFixtures.words(30, "abcd"));
    RecordingTarget target = new RecordingTarget(0);

    slicer.slice(source, target);

    assertThat(target.allSlices())
        .containsExactly(new KaraokeSlice("k", 0, 80), new KaraokeSlice("k", 80, 149));
  }

  @Test
  void slice_breaksNonEmptyPageFirstWhenNoWordFits() {
    KaraokeSource source = source(LayoutFixtures.words(30, "abcd"));
    RecordingTarget target = new RecordingTarget(100);
    target.prefill(5);

    slicer.slice(source, target);

    assertThat(target.finishedPages.get(0)).isEmpty();
    assertThat(target.allSlices().get(0)).isEqualTo(new KaraokeSlice("k", 0, 99));
  }

  @Test
  void slice_coversWholeTextContiguously() {
    String text =
        "The quick brown fox\njumps over the lazy dog.\n\n"
            + LayoutFixtures.words(40, "again")
            + "\nand the last line";
    KaraokeSource source = source(text);
    RecordingTarget target = new RecordingTarget(60);

    slicer.slice(source, target);

    List<KaraokeSlice> slices = target.allSlices();
    assertThat(slices.get(0).startChar()).isZero();
    assertThat(slices.get(slices.size() - 1).endChar()).isEqualTo(text.length());
    for (int i = 1; i < slices.size(); i++) {
      assertThat(slices.get(i).startChar()).isEqualTo(slices.get(i - 1).endChar());
    }
  }

  @Test
  void render_convertsNewlinesAndEscapesText() {
    KaraokeSource source = source("a < b\nc");

    String html = KaraokeSlicer.render(source, new KaraokeSlice("k", 0, 7));

    assertThat(html)
        .startsWith("<div class=\"karaoke-block\"><span class=\"karaoke-slice\"")
        .contains("data-karaoke-start=\"0\"")
        .contains("data-karaoke-end=\"7\"")
        .contains("a &lt; b<br>c");
  }

  private KaraokeSource source(String text) {
    return factory.create("k", text, null, List.of());
  }

  /** Page flow where a fresh page always offers the same height. */
  private static final class RecordingTarget implements SliceTarget {

    private final double freshHeight;
    private final List<List<KaraokeSlice>> finishedPages = new ArrayList<>();
    private List<KaraokeSlice> current = new ArrayList<>();
    private boolean prefilled;
    private double prefilledHeight;

    RecordingTarget(double freshHeight) {
      this.freshHeight = freshHeight;
    }

    void prefill(double remaining) {
      prefilled = true;
      prefilledHeight = remaining;
    }

    @Override
    public boolean isEmpty() {
      return !prefilled && current.isEmpty();
    }

    @Override
    public double remainingHeight() {
      if (prefilled) {
        return prefilledHeight;
      }
      return current.isEmpty() ? freshHeight : 0;
    }

    @Override
    public void place(KaraokeSlice slice, String html) {
      current.add(slice);
    }

    @Override
    public void breakPage() {
      finishedPages.add(current);
      current = new ArrayList<>();
      prefilled = false;
    }

    List<KaraokeSlice> allSlices() {
      List<KaraokeSlice> all = new ArrayList<>();
      finishedPages.forEach(all::addAll);
      all.addAll(current);
      return all;
    }
  }
}
