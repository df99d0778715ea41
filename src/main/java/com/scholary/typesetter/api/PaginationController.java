package com.scholary.typesetter.api;

import com.scholary.typesetter.run.PaginationRun;
import com.scholary.typesetter.service.PaginationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for book pagination.
 *
 * <p>Pagination runs synchronously and returns the pages right away. Soft hyphens are added in
 * the background; fetching the run again returns the hyphenated pages once that pass finished.
 */
@RestController
@Tag(name = "Pagination", description = "Lay out chapters onto fixed-size pages")
public class PaginationController {

  private static final Logger LOGGER = LoggerFactory.getLogger(PaginationController.class);

  private final PaginationService paginationService;

  public PaginationController(PaginationService paginationService) {
    this.paginationService = paginationService;
  }

  @PostMapping("/api/pagination")
  @Operation(
      summary = "Paginate a book",
      description = "Lay out the chapters onto pages and return pages and karaoke slices")
  public ResponseEntity<PaginationResponse> paginate(@Valid @RequestBody PaginateRequest request) {
    LOGGER.info(
        "Pagination request: chapters={}, mode={}", request.chapters().size(), request.mode());
    PaginationRun run = paginationService.paginate(request.toPaginationRequest());
    return ResponseEntity.ok(PaginationResponse.from(run));
  }

  @GetMapping("/api/pagination/{runId}")
  @Operation(
      summary = "Get a pagination run",
      description = "Return the latest pages of a run, hyphenated once the background pass ran")
  public ResponseEntity<PaginationResponse> getRun(@PathVariable String runId) {
    return paginationService
        .findRun(runId)
        .map(run -> ResponseEntity.ok(PaginationResponse.from(run)))
        .orElse(ResponseEntity.notFound().build());
  }
}
