package com.scholary.typesetter.api;

import com.scholary.typesetter.karaoke.KaraokeSlice;
import com.scholary.typesetter.measure.PageMode;
import com.scholary.typesetter.pagination.Page;
import com.scholary.typesetter.run.PaginationRun;
import com.scholary.typesetter.service.ResolvedPosition;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Pages and karaoke data of a pagination run. */
public record PaginationResponse(
    String runId,
    PageMode mode,
    boolean hyphenated,
    List<Page> pages,
    Map<String, KaraokeSourceResponse> karaokeSources,
    Map<String, List<KaraokeSlice>> slices,
    ResolvedPosition initialPosition) {

  public static PaginationResponse from(PaginationRun run) {
    Map<String, KaraokeSourceResponse> sources = new TreeMap<>();
    run.result()
        .karaokeSources()
        .forEach((id, source) -> sources.put(id, KaraokeSourceResponse.from(source)));
    return new PaginationResponse(
        run.runId(),
        run.mode(),
        run.hyphenated(),
        run.pages(),
        sources,
        new TreeMap<>(run.result().slices()),
        run.initialPosition());
  }
}
