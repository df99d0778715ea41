package com.scholary.typesetter.playback;

import com.scholary.typesetter.config.TypesetterProperties;
import com.scholary.typesetter.karaoke.KaraokeSource;
import jakarta.annotation.PreDestroy;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns one playback controller per karaoke source of the current pagination run.
 *
 * <p>Controllers are created on first use and disposed when the run is replaced or the
 * application shuts down.
 */
@Component
public class KaraokeControllerRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(KaraokeControllerRegistry.class);

  private final AudioHandleFactory audioHandles;
  private final FrameScheduler frames;
  private final int maxInitAttempts;
  private final Map<String, KaraokePlaybackController> controllers = new ConcurrentHashMap<>();
  private volatile Map<String, KaraokeSource> sources = Map.of();

  public KaraokeControllerRegistry(
      AudioHandleFactory audioHandles, FrameScheduler frames, TypesetterProperties properties) {
    this.audioHandles = audioHandles;
    this.frames = frames;
    this.maxInitAttempts = properties.karaoke().maxInitAttempts();
  }

  /** Replace the sources of the previous run, disposing its controllers. */
  public synchronized void reset(Collection<KaraokeSource> newSources) {
    disposeAll();
    Map<String, KaraokeSource> byId = new ConcurrentHashMap<>();
    newSources.forEach(source -> byId.put(source.id(), source));
    sources = Map.copyOf(byId);
    LOGGER.debug("Karaoke registry reset: sources={}", sources.size());
  }

  /** Controller for a source of the current run, created on first use. */
  public Optional<KaraokePlaybackController> controller(String karaokeId) {
    KaraokeSource source = sources.get(karaokeId);
    if (source == null) {
      return Optional.empty();
    }
    return Optional.of(
        controllers.computeIfAbsent(
            karaokeId,
            id ->
                new KaraokePlaybackController(
                    source, audioHandles.open(source), frames, maxInitAttempts)));
  }

  /** Controller for a source only if one was already created. */
  public Optional<KaraokePlaybackController> existing(String karaokeId) {
    return Optional.ofNullable(controllers.get(karaokeId));
  }

  /** Only one source plays at a time. */
  public void pauseAllExcept(String karaokeId) {
    controllers.forEach(
        (id, controller) -> {
          if (!id.equals(karaokeId)) {
            controller.pause();
          }
        });
  }

  /** Stop every frame loop when the displayed page changes. */
  public void suspendAll() {
    controllers.values().forEach(KaraokePlaybackController::suspend);
  }

  public void dispose(String karaokeId) {
    KaraokePlaybackController controller = controllers.remove(karaokeId);
    if (controller != null) {
      controller.dispose();
    }
  }

  @PreDestroy
  public void disposeAll() {
    controllers.keySet().forEach(this::dispose);
  }

  public int size() {
    return controllers.size();
  }
}
