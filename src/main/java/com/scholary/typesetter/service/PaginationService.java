package com.scholary.typesetter.service;

import com.scholary.typesetter.config.TypesetterProperties;
import com.scholary.typesetter.config.TypesetterProperties.PageProperties;
import com.scholary.typesetter.hyphenation.HyphenationPass;
import com.scholary.typesetter.logging.StructuredLogger;
import com.scholary.typesetter.measure.PageGeometry;
import com.scholary.typesetter.measure.PageMode;
import com.scholary.typesetter.pagination.Page;
import com.scholary.typesetter.playback.KaraokeControllerRegistry;
import com.scholary.typesetter.run.PaginationRun;
import com.scholary.typesetter.run.PaginationRunRepository;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs pagination end to end.
 *
 * <p>The pages are stored and returned as soon as they are laid out. Hyphenation follows in the
 * background and replaces the stored pages only if no newer run has started and the layout is
 * unchanged.
 */
@Service
public class PaginationService {

  private static final Logger LOGGER = LoggerFactory.getLogger(PaginationService.class);

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);
  private final TypesetterProperties properties;
  private final PaginationDriver driver;
  private final PaginationRunCoordinator coordinator;
  private final PaginationRunRepository repository;
  private final HyphenationPass hyphenationPass;
  private final KaraokeControllerRegistry karaokeControllers;

  public PaginationService(
      TypesetterProperties properties,
      PaginationDriver driver,
      PaginationRunCoordinator coordinator,
      PaginationRunRepository repository,
      HyphenationPass hyphenationPass,
      KaraokeControllerRegistry karaokeControllers) {
    this.properties = properties;
    this.driver = driver;
    this.coordinator = coordinator;
    this.repository = repository;
    this.hyphenationPass = hyphenationPass;
    this.karaokeControllers = karaokeControllers;
  }

  /**
   * Paginate the request's chapters.
   *
   * @throws PaginationSupersededException when a newer run started before this one finished
   */
  public PaginationRun paginate(PaginationRequest request) {
    String runId = UUID.randomUUID().toString();
    long generation = coordinator.begin();
    long startTime = System.currentTimeMillis();
    StructuredLogger.setRunContext(runId, request.mode().name());
    try {
      structuredLogger.logRunStarted(runId, request.chapters().size(), request.mode().name());
      PageGeometry geometry = geometryFor(request);
      PaginationResult result =
          coordinator.runExclusive(
              runId,
              generation,
              superseded -> driver.paginate(request.chapters(), geometry, superseded));

      PaginationRun run =
          new PaginationRun(
              runId,
              generation,
              geometry.mode(),
              result,
              PositionResolver.resolve(result.pages(), request.initialPosition()),
              false,
              Instant.now());
      repository.save(run);
      karaokeControllers.reset(result.karaokeSources().values());
      structuredLogger.logRunFinished(
          runId,
          result.pages().size(),
          result.karaokeSources().size(),
          System.currentTimeMillis() - startTime);

      scheduleHyphenation(run);
      return run;
    } finally {
      StructuredLogger.clearRunContext();
    }
  }

  public Optional<PaginationRun> findRun(String runId) {
    return repository.findById(runId);
  }

  PageGeometry geometryFor(PaginationRequest request) {
    PageProperties page = properties.page();
    if (request.mode() == PageMode.DOCUMENT) {
      return PageGeometry.document(page);
    }
    double width = request.deviceWidth() != null ? request.deviceWidth() : page.deviceWidth();
    double height = request.deviceHeight() != null ? request.deviceHeight() : page.deviceHeight();
    return PageGeometry.device(width, height, page);
  }

  private void scheduleHyphenation(PaginationRun run) {
    hyphenationPass
        .schedule(run.runId(), run.pages(), () -> !coordinator.isCurrent(run.generation()))
        .thenAccept(result -> result.ifPresent(pages -> storeHyphenated(run, pages)))
        .exceptionally(
            error -> {
              LOGGER.warn("Hyphenation failed for run {}", run.runId(), error);
              return null;
            });
  }

  private void storeHyphenated(PaginationRun run, List<Page> hyphenated) {
    if (!coordinator.isCurrent(run.generation())) {
      LOGGER.debug("Discarding hyphenation of superseded run {}", run.runId());
      return;
    }
    repository.update(
        run.runId(),
        stored -> {
          if (!HyphenationPass.sameLayout(stored.pages(), hyphenated)) {
            LOGGER.warn("Page layout changed, skipping hyphenation for run {}", run.runId());
            return stored;
          }
          return stored.withHyphenatedPages(hyphenated);
        });
  }
}
