package com.scholary.typesetter.run;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.typesetter.config.TypesetterProperties;
import java.time.Duration;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.springframework.stereotype.Repository;

/**
 * In-memory store of pagination runs.
 *
 * <p>Caffeine evicts runs by size and age, so memory stays bounded however many books are
 * paginated.
 */
@Repository
public class PaginationRunRepository {

  private final Cache<String, PaginationRun> cache;

  public PaginationRunRepository(TypesetterProperties properties) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(properties.runs().maxSize())
            .expireAfterWrite(Duration.ofMinutes(properties.runs().expireAfterMinutes()))
            .build();
  }

  public void save(PaginationRun run) {
    cache.put(run.runId(), run);
  }

  public Optional<PaginationRun> findById(String runId) {
    return Optional.ofNullable(cache.getIfPresent(runId));
  }

  /** Atomically replace a stored run. Does nothing when the run is no longer stored. */
  public Optional<PaginationRun> update(String runId, UnaryOperator<PaginationRun> change) {
    return Optional.ofNullable(
        cache.asMap().computeIfPresent(runId, (id, run) -> change.apply(run)));
  }

  public void delete(String runId) {
    cache.invalidate(runId);
  }
}
