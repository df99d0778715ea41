package com.scholary.typesetter.service;

import com.scholary.typesetter.content.ChapterRecord;
import com.scholary.typesetter.measure.PageMode;
import java.util.List;

/**
 * Input of a pagination run.
 *
 * @param chapters chapters in any order
 * @param mode page sizing mode
 * @param deviceWidth screen width for device-sized pages, null for the configured default
 * @param deviceHeight screen height for device-sized pages, null for the configured default
 * @param initialPosition saved reading position, may be null
 */
public record PaginationRequest(
    List<ChapterRecord> chapters,
    PageMode mode,
    Double deviceWidth,
    Double deviceHeight,
    ReadingPosition initialPosition) {

  public PaginationRequest {
    chapters = chapters == null ? List.of() : List.copyOf(chapters);
    mode = mode == null ? PageMode.DOCUMENT : mode;
  }
}
