package com.scholary.typesetter.content;

import com.scholary.typesetter.measure.ImageDimensions;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Waits for the images referenced by a chapter before it is measured.
 *
 * <p>Images that declare both width and height need no probing. Every other image is probed
 * concurrently; a failed probe resolves like a successful one, with an unknown size, and the whole
 * wait is bounded by a timeout so a slow host cannot stall pagination.
 */
public class ImageLoadWaiter {

  private static final Logger LOGGER = LoggerFactory.getLogger(ImageLoadWaiter.class);

  private final ImageDimensionProbe probe;
  private final Executor executor;
  private final long waitTimeoutMs;

  public ImageLoadWaiter(ImageDimensionProbe probe, Executor executor, long waitTimeoutMs) {
    this.probe = probe;
    this.executor = executor;
    this.waitTimeoutMs = waitTimeoutMs;
  }

  /**
   * Probe every image without declared dimensions.
   *
   * @param htmlBlocks block HTML to scan
   * @return sizes of the images that resolved in time, keyed by source
   */
  public Map<String, ImageDimensions> awaitImages(Collection<String> htmlBlocks) {
    Set<String> sources = new LinkedHashSet<>();
    for (String html : htmlBlocks) {
      for (Element image : HtmlFragments.parseBody(html).select("img[src]")) {
        if (!image.hasAttr("width") || !image.hasAttr("height")) {
          sources.add(image.attr("src"));
        }
      }
    }
    if (sources.isEmpty()) {
      return Map.of();
    }

    Map<String, CompletableFuture<Optional<ImageDimensions>>> pending = new LinkedHashMap<>();
    for (String src : sources) {
      pending.put(
          src,
          CompletableFuture.supplyAsync(() -> probe.probe(src), executor)
              .exceptionally(
                  error -> {
                    LOGGER.debug("Image probe failed: src={}, error={}", src, error.getMessage());
                    return Optional.empty();
                  }));
    }

    try {
      CompletableFuture.allOf(pending.values().toArray(CompletableFuture[]::new))
          .get(waitTimeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      LOGGER.warn(
          "Image wait timed out after {}ms, continuing with {} of {} images resolved",
          waitTimeoutMs,
          pending.values().stream().filter(CompletableFuture::isDone).count(),
          pending.size());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Image wait interrupted, continuing with resolved images");
    } catch (ExecutionException e) {
      LOGGER.warn("Image wait failed: {}", e.getMessage());
    }

    Map<String, ImageDimensions> resolved = new LinkedHashMap<>();
    pending.forEach(
        (src, future) -> {
          if (future.isDone() && !future.isCompletedExceptionally()) {
            future.join().ifPresent(dimensions -> resolved.put(src, dimensions));
          } else {
            future.cancel(true);
          }
        });
    LOGGER.debug("Resolved {} of {} image sizes", resolved.size(), sources.size());
    return resolved;
  }
}
