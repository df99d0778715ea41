package com.scholary.typesetter.run;

import com.scholary.typesetter.measure.PageMode;
import com.scholary.typesetter.pagination.Page;
import com.scholary.typesetter.service.PaginationResult;
import com.scholary.typesetter.service.ResolvedPosition;
import java.time.Instant;
import java.util.List;

/**
 * A stored pagination result.
 *
 * @param runId run identifier
 * @param generation coordinator generation the run was produced under
 * @param mode page sizing mode
 * @param result pages and karaoke data
 * @param initialPosition where the reader should start
 * @param hyphenated whether soft hyphens have been added to the pages
 * @param createdAt when the run finished
 */
public record PaginationRun(
    String runId,
    long generation,
    PageMode mode,
    PaginationResult result,
    ResolvedPosition initialPosition,
    boolean hyphenated,
    Instant createdAt) {

  public List<Page> pages() {
    return result.pages();
  }

  public PaginationRun withHyphenatedPages(List<Page> pages) {
    return new PaginationRun(
        runId,
        generation,
        mode,
        new PaginationResult(pages, result.karaokeSources(), result.slices()),
        initialPosition,
        true,
        createdAt);
  }
}
