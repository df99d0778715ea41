package com.scholary.typesetter.playback;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Frame scheduler backed by a scheduled executor, ticking at a fixed interval. */
public class ScheduledFrameScheduler implements FrameScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScheduledFrameScheduler.class);

  private final ScheduledExecutorService executor;
  private final long frameIntervalMs;

  public ScheduledFrameScheduler(ScheduledExecutorService executor, long frameIntervalMs) {
    this.executor = executor;
    this.frameIntervalMs = frameIntervalMs;
  }

  @Override
  public FrameLoop start(Runnable frame) {
    ScheduledFuture<?> future =
        executor.scheduleAtFixedRate(
            () -> runFrame(frame), 0, frameIntervalMs, TimeUnit.MILLISECONDS);
    return () -> future.cancel(false);
  }

  private static void runFrame(Runnable frame) {
    try {
      frame.run();
    } catch (RuntimeException e) {
      // an exception would silently end the fixed-rate schedule
      LOGGER.error("Karaoke frame failed", e);
    }
  }
}
