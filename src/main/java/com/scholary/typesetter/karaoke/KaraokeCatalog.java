package com.scholary.typesetter.karaoke;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Karaoke sources found during one pagination run and the slices placed for each. */
public class KaraokeCatalog {

  private final KaraokeSourceFactory factory;
  private final Map<String, KaraokeSource> sources = new LinkedHashMap<>();
  private final Map<String, List<KaraokeSlice>> slices = new LinkedHashMap<>();
  private int generatedIds;

  public KaraokeCatalog(KaraokeSourceFactory factory) {
    this.factory = factory;
  }

  /**
   * Read the karaoke source of an element, reusing an already registered source with the same id.
   *
   * @param elementHtml outer HTML of the karaoke element
   * @param chapterIndex index of the chapter being paginated
   * @param blockId subchapter id, or chapter id for chapter content
   * @return the source, empty when the element carries no usable payload
   */
  public Optional<KaraokeSource> register(String elementHtml, int chapterIndex, String blockId) {
    String fallbackId = "karaoke-" + chapterIndex + "-" + blockId + "-" + generatedIds;
    Optional<KaraokeSource> read = factory.fromElement(elementHtml, fallbackId);
    if (read.isEmpty()) {
      return Optional.empty();
    }
    if (read.get().id().equals(fallbackId)) {
      generatedIds++;
    }
    KaraokeSource existing = sources.putIfAbsent(read.get().id(), read.get());
    return Optional.of(existing != null ? existing : read.get());
  }

  public void recordSlice(KaraokeSlice slice) {
    slices.computeIfAbsent(slice.karaokeId(), id -> new ArrayList<>()).add(slice);
  }

  public Map<String, KaraokeSource> sources() {
    return Collections.unmodifiableMap(sources);
  }

  public Optional<KaraokeSource> source(String karaokeId) {
    return Optional.ofNullable(sources.get(karaokeId));
  }

  public List<KaraokeSlice> slices(String karaokeId) {
    return Collections.unmodifiableList(slices.getOrDefault(karaokeId, List.of()));
  }

  public Map<String, List<KaraokeSlice>> slices() {
    Map<String, List<KaraokeSlice>> copy = new LinkedHashMap<>();
    slices.forEach((id, list) -> copy.put(id, List.copyOf(list)));
    return copy;
  }

  /**
   * Whether the slices of a source, in order, are contiguous and cover its whole text.
   *
   * <p>A source that repeats in the content is sliced once per occurrence; each occurrence must
   * cover the text.
   */
  public boolean isFullyCovered(String karaokeId) {
    KaraokeSource source = sources.get(karaokeId);
    List<KaraokeSlice> placed = slices.get(karaokeId);
    if (source == null || placed == null || placed.isEmpty()) {
      return false;
    }
    int expected = 0;
    for (KaraokeSlice slice : placed) {
      if (slice.startChar() != expected) {
        if (slice.startChar() != 0 || expected != source.length()) {
          return false;
        }
      }
      expected = slice.endChar();
    }
    return expected == source.length();
  }
}
