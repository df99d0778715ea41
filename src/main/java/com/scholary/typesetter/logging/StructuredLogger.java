package com.scholary.typesetter.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields into the MDC for the duration of a single log call, so they can be
 * queried by {@code event_type} in the log pipeline.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log page finalized event. */
  public void logPageFinalized(
      String chapterId, int pageIndex, int elements, int footnotes, boolean overflowAccepted) {
    try {
      MDC.put("event_type", "page_finalized");
      MDC.put("chapterId", chapterId);
      MDC.put("pageIndex", String.valueOf(pageIndex));
      MDC.put("elements", String.valueOf(elements));
      MDC.put("footnotes", String.valueOf(footnotes));
      MDC.put("overflowAccepted", String.valueOf(overflowAccepted));

      logger.debug(
          "Page finalized: chapter={}, page={}, elements={}, footnotes={}, overflow={}",
          chapterId,
          pageIndex,
          elements,
          footnotes,
          overflowAccepted);
    } finally {
      clearEventFields();
    }
  }

  /** Log split decision event. */
  public void logSplitDecision(
      String chapterId, int pageIndex, String decision, double remaining, double overflow) {
    try {
      MDC.put("event_type", "split_decision");
      MDC.put("chapterId", chapterId);
      MDC.put("pageIndex", String.valueOf(pageIndex));
      MDC.put("decision", decision);
      MDC.put("remaining", String.valueOf(remaining));
      MDC.put("overflow", String.valueOf(overflow));

      logger.debug(
          "Split decision: chapter={}, page={}, decision={}, remaining={}px, overflow={}px",
          chapterId,
          pageIndex,
          decision,
          remaining,
          overflow);
    } finally {
      clearEventFields();
    }
  }

  /** Log overflow accepted event. */
  public void logOverflowAccepted(String chapterId, int pageIndex, double overflow, String reason) {
    try {
      MDC.put("event_type", "overflow_accepted");
      MDC.put("chapterId", chapterId);
      MDC.put("pageIndex", String.valueOf(pageIndex));
      MDC.put("overflow", String.valueOf(overflow));

      logger.info(
          "Overflow accepted: chapter={}, page={}, overflow={}px, reason={}",
          chapterId,
          pageIndex,
          overflow,
          reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log karaoke slice event. */
  public void logKaraokeSlice(String karaokeId, int startChar, int endChar, boolean forced) {
    try {
      MDC.put("event_type", "karaoke_slice");
      MDC.put("karaokeId", karaokeId);
      MDC.put("startChar", String.valueOf(startChar));
      MDC.put("endChar", String.valueOf(endChar));
      MDC.put("forced", String.valueOf(forced));

      logger.debug(
          "Karaoke slice: id={}, range=[{}-{}), forced={}", karaokeId, startChar, endChar, forced);
    } finally {
      clearEventFields();
    }
  }

  /** Log run started event. */
  public void logRunStarted(String runId, int chapters, String mode) {
    try {
      MDC.put("event_type", "run_started");
      MDC.put("chapters", String.valueOf(chapters));

      logger.info("Pagination run started: runId={}, chapters={}, mode={}", runId, chapters, mode);
    } finally {
      clearEventFields();
    }
  }

  /** Log run finished event. */
  public void logRunFinished(String runId, int pages, int karaokeSources, long durationMs) {
    try {
      MDC.put("event_type", "run_finished");
      MDC.put("pages", String.valueOf(pages));
      MDC.put("karaokeSources", String.valueOf(karaokeSources));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Pagination run finished: runId={}, pages={}, karaokeSources={}, duration={}ms",
          runId,
          pages,
          karaokeSources,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log run superseded event. */
  public void logRunSuperseded(String runId, long generation, long currentGeneration) {
    try {
      MDC.put("event_type", "run_superseded");
      MDC.put("generation", String.valueOf(generation));
      MDC.put("currentGeneration", String.valueOf(currentGeneration));

      logger.info(
          "Pagination run superseded: runId={}, generation={}, current={}",
          runId,
          generation,
          currentGeneration);
    } finally {
      clearEventFields();
    }
  }

  /** Log hyphenation applied event. */
  public void logHyphenationApplied(String runId, int pagesChanged, int pagesSkipped) {
    try {
      MDC.put("event_type", "hyphenation_applied");
      MDC.put("pagesChanged", String.valueOf(pagesChanged));
      MDC.put("pagesSkipped", String.valueOf(pagesSkipped));

      logger.info(
          "Hyphenation applied: runId={}, changed={}, skipped={}",
          runId,
          pagesChanged,
          pagesSkipped);
    } finally {
      clearEventFields();
    }
  }

  /** Log playback paused at a slice boundary. */
  public void logPlaybackPausedAtBoundary(
      String karaokeId, int sliceEnd, double time, Integer resumeWordIndex) {
    try {
      MDC.put("event_type", "playback_paused_at_boundary");
      MDC.put("karaokeId", karaokeId);
      MDC.put("endChar", String.valueOf(sliceEnd));
      MDC.put("time", String.valueOf(time));
      MDC.put("resumeWordIndex", String.valueOf(resumeWordIndex));

      logger.debug(
          "Playback paused at slice boundary: id={}, sliceEnd={}, time={}s, resumeWord={}",
          karaokeId,
          sliceEnd,
          time,
          resumeWordIndex);
    } finally {
      clearEventFields();
    }
  }

  /** Set run context in MDC. */
  public static void setRunContext(String runId, String mode) {
    MDC.put("runId", runId);
    MDC.put("mode", mode);
  }

  /** Clear run context from MDC. */
  public static void clearRunContext() {
    MDC.remove("runId");
    MDC.remove("mode");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("chapterId");
    MDC.remove("pageIndex");
    MDC.remove("elements");
    MDC.remove("footnotes");
    MDC.remove("overflowAccepted");
    MDC.remove("decision");
    MDC.remove("remaining");
    MDC.remove("overflow");
    MDC.remove("karaokeId");
    MDC.remove("startChar");
    MDC.remove("endChar");
    MDC.remove("forced");
    MDC.remove("chapters");
    MDC.remove("pages");
    MDC.remove("karaokeSources");
    MDC.remove("durationMs");
    MDC.remove("generation");
    MDC.remove("currentGeneration");
    MDC.remove("pagesChanged");
    MDC.remove("pagesSkipped");
    MDC.remove("time");
    MDC.remove("resumeWordIndex");
  }
}
