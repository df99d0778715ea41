package com.scholary.typesetter.hyphenation;

import com.scholary.typesetter.logging.StructuredLogger;
import com.scholary.typesetter.pagination.Page;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Best effort pass that adds soft hyphens to finished text pages.
 *
 * <p>Runs after pages are published. The pass stops as soon as it is cancelled, in which case no
 * pages are produced.
 */
@Component
public class HyphenationPass {

  private static final Logger LOGGER = LoggerFactory.getLogger(HyphenationPass.class);

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);
  private final Hyphenator hyphenator;

  public HyphenationPass(Hyphenator hyphenator) {
    this.hyphenator = hyphenator;
  }

  /** Run {@link #apply} on the task executor. */
  @Async
  public CompletableFuture<Optional<List<Page>>> schedule(
      String runId, List<Page> pages, BooleanSupplier cancelled) {
    try {
      StructuredLogger.setRunContext(runId, "hyphenation");
      return CompletableFuture.completedFuture(apply(runId, pages, cancelled));
    } finally {
      StructuredLogger.clearRunContext();
    }
  }

  /**
   * Hyphenate the pages.
   *
   * @return hyphenated copies of the pages, empty when hyphenation is disabled or was cancelled
   */
  public Optional<List<Page>> apply(String runId, List<Page> pages, BooleanSupplier cancelled) {
    if (!hyphenator.isEnabled()) {
      return Optional.empty();
    }
    List<Page> result = new ArrayList<>(pages.size());
    int changed = 0;
    int skipped = 0;
    for (Page page : pages) {
      if (cancelled.getAsBoolean()) {
        LOGGER.debug("Hyphenation cancelled: runId={}, processed={}", runId, result.size());
        return Optional.empty();
      }
      if (shouldSkip(page)) {
        skipped++;
        result.add(page);
        continue;
      }
      String hyphenated = hyphenator.hyphenateHtml(page.content());
      if (hyphenated.equals(page.content())) {
        result.add(page);
      } else {
        changed++;
        result.add(page.withContent(hyphenated));
      }
    }
    structuredLogger.logHyphenationApplied(runId, changed, skipped);
    return Optional.of(result);
  }

  static boolean shouldSkip(Page page) {
    return page.cover()
        || page.epigraphPage()
        || page.videoPage()
        || page.content().isEmpty()
        || page.content().indexOf(Hyphenator.SOFT_HYPHEN) >= 0
        || page.content().contains("&shy;");
  }

  /** Whether two page lists have the same pages in the same order. */
  public static boolean sameLayout(List<Page> a, List<Page> b) {
    if (a.size() != b.size()) {
      return false;
    }
    for (int i = 0; i < a.size(); i++) {
      Page left = a.get(i);
      Page right = b.get(i);
      if (left.chapterIndex() != right.chapterIndex() || left.pageIndex() != right.pageIndex()) {
        return false;
      }
    }
    return true;
  }
}
