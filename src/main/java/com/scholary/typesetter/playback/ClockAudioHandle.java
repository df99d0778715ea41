package com.scholary.typesetter.playback;

import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Audio handle driven by a monotonic clock instead of a decoder.
 *
 * <p>The playhead advances with the clock while playing and stops at the track duration, at which
 * point the ended listeners run once.
 */
public class ClockAudioHandle implements AudioHandle {

  private static final double NANOS_PER_SECOND = 1_000_000_000.0;

  private final LongSupplier nanoClock;
  private final double durationSeconds;
  private final List<Runnable> endedListeners = new ArrayList<>();
  private double position;
  private long playingSince;
  private boolean playing;
  private boolean released;

  public ClockAudioHandle(LongSupplier nanoClock, double durationSeconds) {
    if (durationSeconds < 0) {
      throw new IllegalArgumentException("Duration must not be negative: " + durationSeconds);
    }
    this.nanoClock = nanoClock;
    this.durationSeconds = durationSeconds;
  }

  @Override
  public void play() {
    List<Runnable> ended;
    synchronized (this) {
      if (released || playing) {
        return;
      }
      playing = true;
      playingSince = nanoClock.getAsLong();
      ended = pollEnded();
    }
    ended.forEach(Runnable::run);
  }

  @Override
  public synchronized void pause() {
    if (playing) {
      position = livePosition();
      playing = false;
    }
  }

  @Override
  public synchronized void seek(double seconds) {
    position = Math.max(0, Math.min(seconds, durationSeconds));
    playingSince = nanoClock.getAsLong();
  }

  @Override
  public double currentTime() {
    double time;
    List<Runnable> ended;
    synchronized (this) {
      time = playing ? livePosition() : position;
      ended = pollEnded();
    }
    ended.forEach(Runnable::run);
    return time;
  }

  @Override
  public synchronized boolean isPlaying() {
    return playing && livePosition() < durationSeconds;
  }

  @Override
  public synchronized void onEnded(Runnable listener) {
    endedListeners.add(listener);
  }

  @Override
  public synchronized void release() {
    playing = false;
    released = true;
    endedListeners.clear();
  }

  private double livePosition() {
    double elapsed = (nanoClock.getAsLong() - playingSince) / NANOS_PER_SECOND;
    return Math.min(position + elapsed, durationSeconds);
  }

  /** Stop at the end of the track and hand out the listeners to notify. */
  private List<Runnable> pollEnded() {
    if (!playing || livePosition() < durationSeconds) {
      return List.of();
    }
    position = durationSeconds;
    playing = false;
    return new ArrayList<>(endedListeners);
  }
}
