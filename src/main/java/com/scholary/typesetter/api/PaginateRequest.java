package com.scholary.typesetter.api;

import com.scholary.typesetter.content.ChapterRecord;
import com.scholary.typesetter.measure.PageMode;
import com.scholary.typesetter.service.PaginationRequest;
import com.scholary.typesetter.service.ReadingPosition;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.List;

/**
 * Request to paginate a book.
 *
 * <p>Device-sized pages use the given screen size, or the configured default when it is omitted.
 */
public record PaginateRequest(
    @NotEmpty List<ChapterRecord> chapters,
    PageMode mode,
    @Positive Double deviceWidth,
    @Positive Double deviceHeight,
    ReadingPosition initialPosition) {

  public PaginationRequest toPaginationRequest() {
    return new PaginationRequest(chapters, mode, deviceWidth, deviceHeight, initialPosition);
  }
}
