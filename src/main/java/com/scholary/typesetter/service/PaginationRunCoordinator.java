package com.scholary.typesetter.service;

import com.scholary.typesetter.logging.StructuredLogger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps pagination runs from overlapping.
 *
 * <p>Every run takes a generation number. Starting a run makes all older generations stale; a
 * stale run stops at its next check. Measurement is serialized by a lock, so a new run waits for
 * the old one to leave the measuring code before it starts.
 */
@Component
public class PaginationRunCoordinator {

  private static final Logger LOGGER = LoggerFactory.getLogger(PaginationRunCoordinator.class);

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);
  private final AtomicLong generation = new AtomicLong();
  private final ReentrantLock measureLock = new ReentrantLock();

  /** Claim the next generation, superseding every run in flight. */
  public long begin() {
    return generation.incrementAndGet();
  }

  public boolean isCurrent(long runGeneration) {
    return generation.get() == runGeneration;
  }

  /**
   * Run a pagination pass exclusively.
   *
   * @param pass receives a check that turns true once a newer run has begun
   * @throws PaginationSupersededException when a newer run began first
   */
  public <T> T runExclusive(String runId, long runGeneration, Function<BooleanSupplier, T> pass) {
    measureLock.lock();
    try {
      if (!isCurrent(runGeneration)) {
        throw new PaginationSupersededException(
            "Run " + runId + " superseded before it started");
      }
      return pass.apply(() -> !isCurrent(runGeneration));
    } catch (PaginationSupersededException e) {
      structuredLogger.logRunSuperseded(runId, runGeneration, generation.get());
      throw e;
    } finally {
      measureLock.unlock();
    }
  }
}
