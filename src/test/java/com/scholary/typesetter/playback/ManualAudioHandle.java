package com.scholary.typesetter.playback;

import java.util.ArrayList;
import java.util.List;

/** Audio handle whose playhead is moved by the test. */
class ManualAudioHandle implements AudioHandle {

  private final List<Runnable> endedListeners = new ArrayList<>();
  private final List<Double> seeks = new ArrayList<>();
  private double time;
  private boolean playing;
  private boolean released;
  private int playCalls;

  @Override
  public void play() {
    playing = true;
    playCalls++;
  }

  @Override
  public void pause() {
    playing = false;
  }

  @Override
  public void seek(double seconds) {
    time = seconds;
    seeks.add(seconds);
  }

  @Override
  public double currentTime() {
    return time;
  }

  @Override
  public boolean isPlaying() {
    return playing;
  }

  @Override
  public void onEnded(Runnable listener) {
    endedListeners.add(listener);
  }

  @Override
  public void release() {
    released = true;
    playing = false;
  }

  void setTime(double seconds) {
    time = seconds;
  }

  void fireEnded() {
    playing = false;
    new ArrayList<>(endedListeners).forEach(Runnable::run);
  }

  List<Double> seeks() {
    return seeks;
  }

  boolean isReleased() {
    return released;
  }

  int playCalls() {
    return playCalls;
  }
}
