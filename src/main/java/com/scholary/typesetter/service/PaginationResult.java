package com.scholary.typesetter.service;

import com.scholary.typesetter.karaoke.KaraokeSlice;
import com.scholary.typesetter.karaoke.KaraokeSource;
import com.scholary.typesetter.pagination.Page;
import java.util.List;
import java.util.Map;

/**
 * Output of one pagination run.
 *
 * @param pages finalized pages in reading order
 * @param karaokeSources karaoke sources keyed by id
 * @param slices slices of each karaoke source in text order
 */
public record PaginationResult(
    List<Page> pages,
    Map<String, KaraokeSource> karaokeSources,
    Map<String, List<KaraokeSlice>> slices) {

  public PaginationResult {
    pages = List.copyOf(pages);
    karaokeSources = Map.copyOf(karaokeSources);
    slices = Map.copyOf(slices);
  }

  public static PaginationResult empty() {
    return new PaginationResult(List.of(), Map.of(), Map.of());
  }
}
