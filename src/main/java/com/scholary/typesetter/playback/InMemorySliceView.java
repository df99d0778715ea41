package com.scholary.typesetter.playback;

import com.scholary.typesetter.karaoke.KaraokeSlice;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Slice view that keeps the highlight state in memory. */
public class InMemorySliceView implements SliceView {

  private final KaraokeSlice slice;
  private final Map<Integer, WordPhase> phases = new HashMap<>();
  private final Map<Integer, Double> fills = new HashMap<>();
  private boolean connected = true;
  private boolean ready = true;
  private boolean playing;
  private String markup;

  public InMemorySliceView(KaraokeSlice slice) {
    this.slice = slice;
  }

  @Override
  public KaraokeSlice slice() {
    return slice;
  }

  @Override
  public synchronized boolean isConnected() {
    return connected;
  }

  @Override
  public synchronized boolean hasWordMarkup() {
    return markup != null;
  }

  @Override
  public synchronized boolean installWordMarkup(String html, List<SliceWord> words) {
    if (!connected || !ready) {
      return false;
    }
    markup = html;
    phases.clear();
    fills.clear();
    words.forEach(word -> phases.put(word.wordIndex(), WordPhase.PENDING));
    return true;
  }

  @Override
  public synchronized void setPlaying(boolean playing) {
    this.playing = playing;
  }

  @Override
  public synchronized void showWord(int wordIndex, WordPhase phase, double fill) {
    phases.put(wordIndex, phase);
    fills.put(wordIndex, fill);
  }

  @Override
  public synchronized void resetWords() {
    phases.replaceAll((index, phase) -> WordPhase.PENDING);
    fills.clear();
  }

  /** Remove the view from its page. */
  public synchronized void detach() {
    connected = false;
  }

  /** Drop installed word markup, as a re-render of the page would. */
  public synchronized void discardWordMarkup() {
    markup = null;
    phases.clear();
    fills.clear();
  }

  /** Control whether the view accepts word markup. */
  public synchronized void setReady(boolean ready) {
    this.ready = ready;
  }

  public synchronized boolean isPlaying() {
    return playing;
  }

  public synchronized String markup() {
    return markup;
  }

  public synchronized WordPhase phase(int wordIndex) {
    return phases.getOrDefault(wordIndex, WordPhase.PENDING);
  }

  public synchronized double fill(int wordIndex) {
    return fills.getOrDefault(wordIndex, 0.0);
  }
}
